package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * fn of { formals -> body | ... }
 */
public record CaseLambdaNode(List<LambdaNode> clauses) implements ExpressionNode {

    public CaseLambdaNode {
        clauses = List.copyOf(clauses);
    }
}
