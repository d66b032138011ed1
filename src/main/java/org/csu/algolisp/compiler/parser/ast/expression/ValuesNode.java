package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * A parenthesised tuple {@code (a, b)} or {@code ()}; a single plain item is never a ValuesNode.
 */
public record ValuesNode(List<ExpressionNode> expressions, boolean hasSplice) implements ExpressionNode {

    public ValuesNode {
        expressions = List.copyOf(expressions);
    }
}
