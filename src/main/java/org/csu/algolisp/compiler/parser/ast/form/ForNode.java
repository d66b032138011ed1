package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: for 循环
 *
 * @param result value returned when {@code until} holds, may be null
 * @param body   definitions and commands, no tail
 */
public record ForNode(
        List<SteppedBindingNode> steppedBindings,
        ExpressionNode until,
        ExpressionNode result,
        DoNode body
) implements ExpressionNode {

    public ForNode {
        steppedBindings = List.copyOf(steppedBindings);
    }
}
