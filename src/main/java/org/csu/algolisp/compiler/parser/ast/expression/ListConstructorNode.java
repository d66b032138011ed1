package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 列表构造 [a, b, @rest]
 */
public record ListConstructorNode(List<ExpressionNode> items, boolean hasSplice) implements ExpressionNode {

    public ListConstructorNode {
        items = List.copyOf(items);
    }
}
