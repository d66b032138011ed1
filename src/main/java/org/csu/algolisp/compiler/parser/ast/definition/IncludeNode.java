package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.compiler.parser.ast.DefinitionNode;

import java.util.List;

public record IncludeNode(boolean caseInsensitive, List<String> files) implements DefinitionNode {

    public IncludeNode {
        files = List.copyOf(files);
    }
}
