package org.csu.algolisp.compiler.parser.ast.expression;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * A datum read through the escape hatch; emitted exactly as read.
 */
public record EscapedDatumNode(Datum datum, Token token) implements ExpressionNode {
}
