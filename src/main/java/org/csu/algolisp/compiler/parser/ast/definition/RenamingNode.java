package org.csu.algolisp.compiler.parser.ast.definition;

/**
 * from as to
 */
public record RenamingNode(String from, String to) {
}
