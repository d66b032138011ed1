package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 函数调用 f(a, b)
 *
 * @param hasSplice the last argument was written {@code @expr}
 */
public record ApplicationNode(
        ExpressionNode callee,
        List<ExpressionNode> arguments,
        boolean hasSplice
) implements ExpressionNode {

    public ApplicationNode {
        arguments = List.copyOf(arguments);
    }
}
