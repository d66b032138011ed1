package org.csu.algolisp.compiler.parser;

import org.csu.algolisp.common.exception.NameException;
import org.csu.algolisp.common.exception.ParseException;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.compiler.layout.LayoutEngine;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.lexer.TokenType;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;
import org.csu.algolisp.compiler.parser.ast.expression.ApplicationNode;
import org.csu.algolisp.compiler.parser.ast.expression.EscapedDatumNode;
import org.csu.algolisp.compiler.parser.ast.expression.IdentifierNode;
import org.csu.algolisp.compiler.parser.ast.expression.ListConstructorNode;
import org.csu.algolisp.compiler.parser.ast.expression.LiteralNode;
import org.csu.algolisp.compiler.parser.ast.expression.OperatorExpressionNode;
import org.csu.algolisp.compiler.parser.ast.expression.SymbolicConstantNode;
import org.csu.algolisp.compiler.parser.ast.expression.ValuesNode;
import org.csu.algolisp.compiler.parser.ast.expression.VectorConstructorNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * @author hidyouth
 * @description: 表达式语法分析器
 * 采用递归下降法, one method per priority level (1 weakest .. 7 strongest, then unary
 * and application). Keyword-headed forms are delegated to the structural productions.
 */
public abstract class ExpressionParser {

    protected final LayoutEngine layout;
    private Token previous;

    private static final Set<TokenType> LITERALS = Set.of(
            TokenType.INTEGER, TokenType.DECIMAL, TokenType.RATIONAL, TokenType.IMAGINARY,
            TokenType.COMPLEX, TokenType.PREFIXED_NUMBER, TokenType.STRING, TokenType.CHAR,
            TokenType.TRUE, TokenType.FALSE
    );

    private static final Set<TokenType> COMPARISONS = Set.of(
            TokenType.EQUAL_EQUAL, TokenType.EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.GREATER, TokenType.GREATER_EQUAL
    );

    protected ExpressionParser(LayoutEngine layout) {
        this.layout = layout;
    }

    /**
     * A keyword-headed form (fn, if, cond, ...) starting at the current token, or null
     * when the current token does not start one.
     */
    protected abstract ExpressionNode parseKeywordForm();

    /**
     * {@code { entry; ... }} used as an expression.
     */
    protected abstract ExpressionNode parseBraceBlock();

    public ExpressionNode parseExpression() {
        return parseAppendCons();
    }

    // 优先级 1: @ (append) 与 : (cons), 右结合
    private ExpressionNode parseAppendCons() {
        ExpressionNode left = parseOrExpression();
        if (match(TokenType.AT, TokenType.COLON)) {
            Token operator = previous();
            ExpressionNode right = parseAppendCons();
            return new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            Token operator = previous();
            ExpressionNode right = parseAndExpression();
            left = new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (match(TokenType.AND)) {
            Token operator = previous();
            ExpressionNode right = parseNotExpression();
            left = new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        if (match(TokenType.NOT)) {
            Token operator = previous();
            return new OperatorExpressionNode(operator, List.of(parseNotExpression()));
        }
        return parseComparison();
    }

    // 比较运算不可结合: a < b < c 是语法错误
    private ExpressionNode parseComparison() {
        ExpressionNode left = parseAdditive();
        if (COMPARISONS.contains(peek().type())) {
            Token operator = advance();
            ExpressionNode right = parseAdditive();
            if (COMPARISONS.contains(peek().type())) {
                throw ParseException.because(peek(), String.format(
                        "Comparison operators do not chain; parenthesise '%s ... %s'",
                        operator.lexeme(), peek().lexeme()));
            }
            return new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode left = parseMultiplicative();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            ExpressionNode right = parseMultiplicative();
            left = new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseMultiplicative() {
        ExpressionNode left = parseUnary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.QUO, TokenType.REM, TokenType.DIV, TokenType.MOD)) {
            Token operator = previous();
            ExpressionNode right = parseUnary();
            left = new OperatorExpressionNode(operator, List.of(left, right));
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (match(TokenType.MINUS, TokenType.PLUS)) {
            Token operator = previous();
            return new OperatorExpressionNode(operator, List.of(parseUnary()));
        }
        return parseApplication();
    }

    // 函数调用优先级最高, 并且可以连续: f(x)(y)
    private ExpressionNode parseApplication() {
        ExpressionNode expr = parsePrimaryExpression();
        while (match(TokenType.LPAREN)) {
            ItemList arguments = parseItems(TokenType.RPAREN, "')' to close the argument list");
            expr = new ApplicationNode(expr, arguments.items(), arguments.spliced());
        }
        return expr;
    }

    private ExpressionNode parsePrimaryExpression() {
        if (LITERALS.contains(peek().type())) {
            return new LiteralNode(advance());
        }
        if (check(TokenType.IDENTIFIER)) {
            Token identifier = advance();
            return new IdentifierNode(identifier.name(), identifier);
        }
        if (check(TokenType.CONSTANT)) {
            Token constant = advance();
            return new SymbolicConstantNode(constant.name(), constant);
        }
        if (check(TokenType.ELLIPSIS)) {
            return new IdentifierNode("...", advance());
        }
        if (check(TokenType.ESCAPED_DATUM)) {
            Token escaped = advance();
            return new EscapedDatumNode((Datum) escaped.value(), escaped);
        }
        if (match(TokenType.LPAREN)) {
            ItemList items = parseItems(TokenType.RPAREN, "')' after expression");
            if (items.items().size() == 1 && !items.spliced()) {
                return items.items().get(0);
            }
            return new ValuesNode(items.items(), items.spliced());
        }
        if (match(TokenType.LBRACKET)) {
            ItemList items = parseItems(TokenType.RBRACKET, "']' to close the list");
            return new ListConstructorNode(items.items(), items.spliced());
        }
        if (match(TokenType.VECTOR_OPEN)) {
            ItemList items = parseItems(TokenType.RBRACKET, "']' to close the vector");
            return new VectorConstructorNode(items.items(), items.spliced());
        }
        if (check(TokenType.LBRACE)) {
            return parseBraceBlock();
        }
        ExpressionNode form = parseKeywordForm();
        if (form != null) {
            return form;
        }
        throw new ParseException(peek(), "an expression");
    }

    /**
     * Comma separated items up to {@code closer}; a spliced {@code @item} may only come last.
     */
    protected ItemList parseItems(TokenType closer, String closerText) {
        List<ExpressionNode> items = new ArrayList<>();
        boolean spliced = false;
        if (!check(closer)) {
            do {
                if (match(TokenType.AT)) {
                    items.add(parseExpression());
                    spliced = true;
                    if (!check(closer)) {
                        throw ParseException.because(peek(), "A spliced '@' item must be the last item");
                    }
                    break;
                }
                items.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        consume(closer, closerText);
        return new ItemList(items, spliced);
    }

    protected record ItemList(List<ExpressionNode> items, boolean spliced) {
    }

    // --- 辅助方法 ---

    protected Token consumeIdentifier(String expected) {
        if (check(TokenType.IDENTIFIER)) {
            return advance();
        }
        if (peek().type().isKeyword()) {
            throw new NameException(peek());
        }
        throw new ParseException(peek(), expected);
    }

    /**
     * Consumes a continuation keyword such as {@code then} or {@code in}. A virtual separator
     * right before it comes from the keyword starting a new line at block column and is dropped.
     */
    protected Token consumeContinuation(TokenType keyword, String expected) {
        if ((check(TokenType.SEMICOLON) || check(TokenType.BAR))
                && peek().virtual()
                && layout.peek(1).type() == keyword) {
            advance();
        }
        return consume(keyword, expected);
    }

    protected boolean checkContextual(String word) {
        return check(TokenType.IDENTIFIER) && peek().lexeme().equals(word);
    }

    protected boolean matchContextual(String word) {
        if (checkContextual(word)) {
            advance();
            return true;
        }
        return false;
    }

    protected boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    protected Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    protected boolean check(TokenType type) {
        return peek().type() == type;
    }

    protected Token advance() {
        previous = layout.next();
        return previous;
    }

    protected boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    protected Token peek() {
        return layout.peek();
    }

    protected Token previous() {
        return previous;
    }
}
