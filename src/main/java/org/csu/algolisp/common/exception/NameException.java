package org.csu.algolisp.common.exception;

import org.csu.algolisp.compiler.lexer.Token;

/**
 * A reserved word appeared where an identifier is required.
 */
public class NameException extends TranslationException {

    public NameException(Token token) {
        super("Name", token.line(), token.column(), token,
                String.format("'%s' is a reserved word and cannot be used as an identifier", token.lexeme()));
    }
}
