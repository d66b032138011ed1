package org.csu.algolisp.common.exception;

import org.csu.algolisp.compiler.lexer.Token;

/**
 * @author hidyouth
 */
public class ParseException extends TranslationException {

    private ParseException(String detail, Token token) {
        super("Syntax", token.line(), token.column(), token, detail);
    }

    public ParseException(Token token, String expected) {
        this(String.format("Expected %s, but found '%s' (%s)",
                expected,
                token.lexeme(),
                token.type()), token);
    }

    /**
     * A syntax error that is not about a missing token, e.g. a duplicate parameter.
     */
    public static ParseException because(Token token, String reason) {
        return new ParseException(reason, token);
    }
}
