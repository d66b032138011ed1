package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.compiler.parser.ast.AstNode;
import org.csu.algolisp.compiler.parser.ast.DefinitionNode;

import java.util.List;

/**
 * AST 节点: library 定义
 *
 * @param name    库名各段 (symbols and exact integers)
 * @param entries exports, imports, includes, definitions and expressions in source order
 */
public record LibraryNode(List<Datum> name, List<AstNode> entries) implements DefinitionNode {

    public LibraryNode {
        name = List.copyOf(name);
        entries = List.copyOf(entries);
    }
}
