package org.csu.algolisp.compiler.lexer;

/**
 * @author hidyouth
 * @description: 定义词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    FN, IF, THEN, ELSE, COND, CASE, OF, DO,
    LET, LETREC, VAL, SYNTAX, RULES, IN,
    FOR, UNTIL, GUARD,
    IMPORT, EXPORT, LIBRARY, INCLUDE, INCLUDE_CI, RECORD,
    AND, OR, NOT, QUO, REM, DIV, MOD,
    TRUE, FALSE,

    // ---- 标识符 (Identifier) ----
    IDENTIFIER,     // value holds the translated name
    CONSTANT,       // all-uppercase identifier, value holds the lowercase symbol name

    // ---- 常量 (Constants) ----
    INTEGER,
    DECIMAL,
    RATIONAL,
    IMAGINARY,
    COMPLEX,
    PREFIXED_NUMBER, // #x1F, #e1.5 ...
    STRING,
    CHAR,
    ESCAPED_DATUM,  // \<datum>, value holds the Datum

    // ---- 运算符 (Operators) ----
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    SLASH,          // /
    EQUAL,          // =
    EQUAL_EQUAL,    // ==
    LESS,           // <
    LESS_EQUAL,     // <=
    GREATER,        // >
    GREATER_EQUAL,  // >=
    AT,             // @
    COLON,          // :
    ARROW,          // ->

    // ---- 分隔符 (Delimiters) ----
    COMMA,          // ,
    SEMICOLON,      // ; (also the virtual block separator)
    BAR,            // | (also the virtual alternative separator)
    DOT,            // .
    ELLIPSIS,       // ...
    LPAREN,         // (
    RPAREN,         // )
    LBRACKET,       // [
    VECTOR_OPEN,    // #[
    RBRACKET,       // ]
    LBRACE,         // {
    RBRACE,         // }

    // ---- 特殊 Token ----
    VIRTUAL_OPEN,
    VIRTUAL_CLOSE,
    EOF;

    public boolean isKeyword() {
        return ordinal() <= FALSE.ordinal();
    }

    public boolean isNumber() {
        return this == INTEGER || this == DECIMAL || this == RATIONAL
                || this == IMAGINARY || this == COMPLEX || this == PREFIXED_NUMBER;
    }
}
