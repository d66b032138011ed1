package org.csu.algolisp.common.exception;

/**
 * Raised by the lexer: unterminated literals or comments, bad escapes,
 * malformed or ambiguous numerals, characters outside the alphabet.
 */
public class LexicalException extends TranslationException {

    public LexicalException(int line, int column, String detail) {
        super("Lexical", line, column, null, detail);
    }

    public LexicalException(int line, int column, String detail, Throwable cause) {
        super("Lexical", line, column, null, detail, cause);
    }
}
