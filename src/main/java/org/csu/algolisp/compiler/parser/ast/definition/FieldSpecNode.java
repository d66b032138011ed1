package org.csu.algolisp.compiler.parser.ast.definition;

/**
 * field -> accessor [, modifier]; {@code modifier} may be null.
 */
public record FieldSpecNode(String field, String accessor, String modifier) {
}
