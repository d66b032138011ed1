package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 表示一个一元或二元运算表达式 (e.g., -x, a + b)
 */
public record OperatorExpressionNode(
        Token operator,
        List<ExpressionNode> operands
) implements ExpressionNode {

    public OperatorExpressionNode {
        operands = List.copyOf(operands);
    }

    public boolean isUnary() {
        return operands.size() == 1;
    }
}
