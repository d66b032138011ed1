package org.csu.algolisp.compiler.parser.ast.form;

import org.csu.algolisp.compiler.parser.ast.ExpressionNode;

import java.util.List;

/**
 * rules(literal, ...) of { pattern -> template | ... }
 */
public record SyntaxRulesNode(List<String> literals, List<RuleNode> rules) implements ExpressionNode {

    public SyntaxRulesNode {
        literals = List.copyOf(literals);
        rules = List.copyOf(rules);
    }
}
