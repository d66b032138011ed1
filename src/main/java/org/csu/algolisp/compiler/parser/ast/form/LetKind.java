package org.csu.algolisp.compiler.parser.ast.form;

public enum LetKind {
    LET,
    LETREC,
    LET_SYNTAX,
    LETREC_SYNTAX,
    PARAMETERIZE,
    NAMED_LET
}
