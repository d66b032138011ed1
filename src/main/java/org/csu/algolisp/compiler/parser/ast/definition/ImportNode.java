package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;

import java.util.List;

/**
 * AST 节点: import 声明
 */
public record ImportNode(List<ImportSetNode> importSets) implements DefinitionNode {

    public ImportNode {
        importSets = List.copyOf(importSets);
    }
}
