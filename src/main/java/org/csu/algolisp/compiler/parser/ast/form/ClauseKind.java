package org.csu.algolisp.compiler.parser.ast.form;

/**
 * Shape of a cond, case or guard clause.
 */
public enum ClauseKind {
    /** test -> e */
    VALUE,
    /** test -> . */
    TEST_ONLY,
    /** test -> . f */
    RECEIVER,
    /** a lone expression, the else clause */
    ELSE,
    /** -> . f */
    ELSE_RECEIVER
}
