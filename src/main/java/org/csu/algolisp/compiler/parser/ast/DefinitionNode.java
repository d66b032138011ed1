package org.csu.algolisp.compiler.parser.ast;

/**
 * Marker for entries that define or declare something: they may appear at top level,
 * in a library body, and (for val/syntax/record) at the head of a block.
 */
public interface DefinitionNode extends AstNode {
}
