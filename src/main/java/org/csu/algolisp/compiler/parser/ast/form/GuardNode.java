package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.lexer.TokenType;
import org.csu.algolisp.compiler.parser.ast.expression.LiteralNode;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * guard var of { clauses } do { body }
 */
public record GuardNode(
        String variable,
        List<ClauseNode> clauses,
        DoNode body,
        Token token
) implements ExpressionNode {

    public GuardNode {
        clauses = List.copyOf(clauses);
    }

    /**
     * The last clause accepts every condition: {@code -> . f} or a {@code true} test.
     */
    public boolean hasCatchAll() {
        if (clauses.isEmpty()) {
            return false;
        }
        ClauseNode last = clauses.get(clauses.size() - 1);
        return last.kind() == ClauseKind.ELSE_RECEIVER
                || (last.test() instanceof LiteralNode literal && literal.literal().type() == TokenType.TRUE);
    }
}
