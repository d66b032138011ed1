package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * pattern -> template, both written as ordinary expressions.
 */
public record RuleNode(ExpressionNode pattern, ExpressionNode template) {
}
