package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

/**
 * A cond or guard clause.
 *
 * @param test   null for ELSE and ELSE_RECEIVER
 * @param result null for TEST_ONLY
 * @param token  first token of the clause
 */
public record ClauseNode(ExpressionNode test, ClauseKind kind, ExpressionNode result, Token token) {
}
