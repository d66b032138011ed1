package org.csu.algolisp.common.exception;

import org.csu.algolisp.compiler.lexer.Token;

/**
 * Raised by the layout engine when indentation or explicit closers
 * do not fit the stack of open contexts.
 */
public class LayoutException extends TranslationException {

    public LayoutException(Token token, String detail) {
        super("Layout", token.line(), token.column(), token, detail);
    }
}
