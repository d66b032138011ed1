package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * AST 节点: if test then consequent else alternative
 */
public record IfNode(
        ExpressionNode test,
        ExpressionNode consequent,
        ExpressionNode alternative
) implements ExpressionNode {
}
