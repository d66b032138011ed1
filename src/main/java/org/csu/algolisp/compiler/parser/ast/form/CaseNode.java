package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * AST 节点: case subject of { patterns -> result | ... }
 */
public record CaseNode(ExpressionNode subject, List<CaseClauseNode> clauses) implements ExpressionNode {

    public CaseNode {
        clauses = List.copyOf(clauses);
    }
}
