package org.csu.algolisp.compiler.parser.ast.definition;

/**
 * name [as alias]; {@code alias} is null when the name is exported unchanged.
 */
public record ExportSpec(String name, String alias) {
}
