package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * An all-uppercase name such as {@code RED}; {@code name} is already lowercased.
 */
public record SymbolicConstantNode(String name, Token token) implements ExpressionNode {
}
