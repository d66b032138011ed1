package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * i = init [then step]; {@code step} may be null.
 */
public record SteppedBindingNode(String name, ExpressionNode init, ExpressionNode step) {
}
