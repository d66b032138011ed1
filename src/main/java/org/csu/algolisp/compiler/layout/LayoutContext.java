package org.csu.algolisp.compiler.layout;

import org.csu.algolisp.compiler.lexer.Token;
import org.csu.algolisp.compiler.lexer.TokenType;

/**
 * One entry of the layout stack.
 *
 * @param kind            what opened the context
 * @param referenceColumn column entries must align to; unused for EXPLICIT and BRACKET
 * @param opener          the token that opened the context, null for TOP
 */
public record LayoutContext(Kind kind, int referenceColumn, Token opener) {

    public enum Kind {
        TOP,
        BLOCK,
        ALTERNATIVE,
        EXPLICIT,
        BRACKET
    }

    public boolean isImplicit() {
        return kind == Kind.TOP || kind == Kind.BLOCK || kind == Kind.ALTERNATIVE;
    }

    /**
     * Separator emitted when a line starts at the reference column.
     */
    public TokenType separator() {
        return kind == Kind.ALTERNATIVE ? TokenType.BAR : TokenType.SEMICOLON;
    }

    public boolean closedBy(TokenType closer) {
        return switch (closer) {
            case RBRACE -> kind == Kind.EXPLICIT;
            case RPAREN -> kind == Kind.BRACKET && opener.type() == TokenType.LPAREN;
            case RBRACKET -> kind == Kind.BRACKET
                    && (opener.type() == TokenType.LBRACKET || opener.type() == TokenType.VECTOR_OPEN);
            default -> false;
        };
    }
}
