package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: 向量构造 #[a, b, @rest]
 */
public record VectorConstructorNode(List<ExpressionNode> items, boolean hasSplice) implements ExpressionNode {

    public VectorConstructorNode {
        items = List.copyOf(items);
    }
}
