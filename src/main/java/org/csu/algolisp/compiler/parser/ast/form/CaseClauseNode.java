package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * A case clause. {@code patterns} holds the literal alternatives and is empty for the
 * else forms; constants appear here as plain symbols.
 */
public record CaseClauseNode(List<Datum> patterns, ClauseKind kind, ExpressionNode result, Token token) {

    public CaseClauseNode {
        patterns = List.copyOf(patterns);
    }
}
