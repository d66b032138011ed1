package org.csu.algolisp.compiler.lexer;

/**
 * @param type      词法单元的类型 (种别码)
 * @param lexeme    词法单元的原始文本 (词素值)
 * @param value     decoded payload: translated name, string contents, code point or escaped datum
 * @param line      所在的行号
 * @param column    所在的列号
 * @param offset    index of the first source character
 * @param end       index one past the last source character
 * @param lineStart whether this is the first token on its line
 * @param virtual   whether the layout engine inserted this token
 */
public record Token(TokenType type, String lexeme, Object value, int line, int column,
                    int offset, int end, boolean lineStart, boolean virtual) {

    public static Token virtual(TokenType type, String lexeme, Token anchor) {
        return new Token(type, lexeme, null, anchor.line(), anchor.column(),
                anchor.offset(), anchor.offset(), false, true);
    }

    /**
     * True when {@code next} starts exactly where this token ends.
     */
    public boolean touches(Token next) {
        return end == next.offset();
    }

    public String name() {
        return (String) value;
    }

    @Override
    public String toString() {
        // 重写toString方法，方便调试和打印
        return String.format("Token[Type=%-15s, Lexeme='%s', Position=%d:%d%s]",
                type, lexeme, line, column, virtual ? ", virtual" : "");
    }
}
