package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;

import java.util.List;

public record ExportNode(List<ExportSpec> specs) implements DefinitionNode {

    public ExportNode {
        specs = List.copyOf(specs);
    }
}
