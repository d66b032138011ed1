package org.csu.algolisp.compiler.parser.ast.definition;

/**
 * How an import set was built: a bare library name, or a modifier applied to an inner set.
 */
public enum ImportModifier {
    LIBRARY,
    EXPOSING,
    HIDING,
    RENAMING,
    QUALIFYING
}
