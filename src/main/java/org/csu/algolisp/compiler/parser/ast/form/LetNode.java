package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: let 家族
 *
 * @param name loop name for NAMED_LET, otherwise null
 */
public record LetNode(
        LetKind kind,
        String name,
        List<BindingNode> bindings,
        ExpressionNode body
) implements ExpressionNode {

    public LetNode {
        bindings = List.copyOf(bindings);
    }

    public boolean hasDestructuring() {
        return bindings.stream().anyMatch(BindingNode::isDestructuring);
    }
}
