package org.csu.algolisp.common.exception;

import lombok.Getter;
import org.csu.algolisp.compiler.lexer.Token;

/**
 * Base of every error raised while translating one unit of source.
 * Carries the source position and, where one exists, the offending token.
 */
@Getter
public class TranslationException extends RuntimeException {

    private final int line;
    private final int column;
    private final Token token;

    protected TranslationException(String kind, int line, int column, Token token, String detail) {
        super(String.format("%s Error at line %d, column %d: %s", kind, line, column, detail));
        this.line = line;
        this.column = column;
        this.token = token;
    }

    protected TranslationException(String kind, int line, int column, Token token, String detail, Throwable cause) {
        this(kind, line, column, token, detail);
        initCause(cause);
    }
}
