package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * syntax name = transformer
 */
public record SyntaxDefinitionNode(String name, ExpressionNode transformer) implements DefinitionNode {
}
