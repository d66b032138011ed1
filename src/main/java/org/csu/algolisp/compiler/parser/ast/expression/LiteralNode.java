package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.common.model.BooleanDatum;
import org.csu.algolisp.common.model.CharDatum;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.NumberDatum;
import org.csu.algolisp.common.model.StringDatum;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: 表示一个字面量 (数字、字符串、字符、布尔值)
 */
public record LiteralNode(Token literal) implements ExpressionNode {

    public Datum toDatum() {
        return switch (literal.type()) {
            case INTEGER, DECIMAL, RATIONAL, COMPLEX, PREFIXED_NUMBER -> new NumberDatum(literal.lexeme());
            case IMAGINARY -> {
                // 无符号虚数在Scheme中不是合法的数字
                String text = literal.lexeme();
                yield new NumberDatum(text.startsWith("+") || text.startsWith("-") ? text : "+" + text);
            }
            case STRING -> new StringDatum((String) literal.value());
            case CHAR -> new CharDatum((Integer) literal.value());
            case TRUE -> BooleanDatum.TRUE;
            case FALSE -> BooleanDatum.FALSE;
            default -> throw new IllegalStateException("Not a literal token: " + literal);
        };
    }
}
