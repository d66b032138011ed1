package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

public record CondNode(List<ClauseNode> clauses) implements ExpressionNode {

    public CondNode {
        clauses = List.copyOf(clauses);
    }
}
