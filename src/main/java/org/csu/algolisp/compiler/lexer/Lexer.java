package org.csu.algolisp.compiler.lexer;

import org.csu.algolisp.common.exception.LexicalException;
import org.csu.algolisp.reader.DatumReadException;
import org.csu.algolisp.reader.EscapeDelegate;
import org.csu.algolisp.reader.ReadResult;
import org.csu.algolisp.reader.SchemeNumeral;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将源程序分解为一系列的Token。Identifiers are translated to Scheme names here,
 * escapes are handed to the {@link EscapeDelegate}, and compound numerals are rebuilt by
 * {@link NumeralReconstructor} once the whole unit is scanned.
 */
public class Lexer {

    private final String input;
    private final EscapeDelegate escapeDelegate;
    private final boolean charHexTerminatorRequired;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号
    private boolean lineHasToken = false;

    // 关键字映射表
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("fn", TokenType.FN);
        keywords.put("if", TokenType.IF);
        keywords.put("then", TokenType.THEN);
        keywords.put("else", TokenType.ELSE);
        keywords.put("cond", TokenType.COND);
        keywords.put("case", TokenType.CASE);
        keywords.put("of", TokenType.OF);
        keywords.put("do", TokenType.DO);
        keywords.put("let", TokenType.LET);
        keywords.put("letrec", TokenType.LETREC);
        keywords.put("val", TokenType.VAL);
        keywords.put("syntax", TokenType.SYNTAX);
        keywords.put("rules", TokenType.RULES);
        keywords.put("in", TokenType.IN);
        keywords.put("for", TokenType.FOR);
        keywords.put("until", TokenType.UNTIL);
        keywords.put("guard", TokenType.GUARD);
        keywords.put("import", TokenType.IMPORT);
        keywords.put("export", TokenType.EXPORT);
        keywords.put("library", TokenType.LIBRARY);
        keywords.put("include", TokenType.INCLUDE);
        keywords.put("include_ci", TokenType.INCLUDE_CI);
        keywords.put("record", TokenType.RECORD);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
        keywords.put("quo", TokenType.QUO);
        keywords.put("rem", TokenType.REM);
        keywords.put("div", TokenType.DIV);
        keywords.put("mod", TokenType.MOD);
        keywords.put("true", TokenType.TRUE);
        keywords.put("false", TokenType.FALSE);
    }

    public Lexer(String input, EscapeDelegate escapeDelegate) {
        this(input, escapeDelegate, false);
    }

    public Lexer(String input, EscapeDelegate escapeDelegate, boolean charHexTerminatorRequired) {
        this.input = input;
        this.escapeDelegate = escapeDelegate;
        this.charHexTerminatorRequired = charHexTerminatorRequired;
    }

    public static boolean isReserved(String word) {
        return keywords.containsKey(word);
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表, always terminated by EOF
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return NumeralReconstructor.reconstruct(tokens);
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        skipWhitespaceAndComments();

        int start = position;
        int startLine = line;
        int startCol = column;
        boolean lineStart = !lineHasToken;

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", null, line, column, position, position, true, false);
        }

        char currentChar = peek();

        // 识别标识符或关键字
        if (Character.isLetter(currentChar)) {
            return readIdentifierOrKeyword(start, startLine, startCol, lineStart);
        }

        // 单独的 _ 是模式通配符
        if (currentChar == '_' && !isIdentifierPart(peekNext())) {
            advance();
            return makeToken(TokenType.IDENTIFIER, "_", start, startLine, startCol, lineStart);
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber(start, startLine, startCol, lineStart);
        }

        switch (currentChar) {
            case '"':
                return readString(start, startLine, startCol, lineStart);
            case '\'':
                return readChar(start, startLine, startCol, lineStart);
            case '\\':
                return readEscape(start, startLine, startCol, lineStart);
            case '#':
                if (peekNext() == '[') {
                    advance();
                    return consumeAndReturn(TokenType.VECTOR_OPEN, start, startLine, startCol, lineStart);
                }
                if (SchemeNumeral.hasPrefix(input, position)) {
                    return readPrefixedNumber(start, startLine, startCol, lineStart);
                }
                throw new LexicalException(startLine, startCol, "Unexpected '#'; expected '#[' or a numeral prefix (#b #o #d #x #e #i)");
            case '+':
                return consumeAndReturn(TokenType.PLUS, start, startLine, startCol, lineStart);
            case '-':
                if (peekNext() == '>') {
                    advance(); // consume '-'
                    return consumeAndReturn(TokenType.ARROW, start, startLine, startCol, lineStart);
                }
                return consumeAndReturn(TokenType.MINUS, start, startLine, startCol, lineStart);
            case '*':
                return consumeAndReturn(TokenType.STAR, start, startLine, startCol, lineStart);
            case '/':
                return consumeAndReturn(TokenType.SLASH, start, startLine, startCol, lineStart);
            case '=':
                if (peekNext() == '=') {
                    advance(); // consume '='
                    return consumeAndReturn(TokenType.EQUAL_EQUAL, start, startLine, startCol, lineStart);
                }
                return consumeAndReturn(TokenType.EQUAL, start, startLine, startCol, lineStart);
            case '<':
                if (peekNext() == '=') {
                    advance();
                    return consumeAndReturn(TokenType.LESS_EQUAL, start, startLine, startCol, lineStart);
                }
                return consumeAndReturn(TokenType.LESS, start, startLine, startCol, lineStart);
            case '>':
                if (peekNext() == '=') {
                    advance();
                    return consumeAndReturn(TokenType.GREATER_EQUAL, start, startLine, startCol, lineStart);
                }
                return consumeAndReturn(TokenType.GREATER, start, startLine, startCol, lineStart);
            case '@':
                return consumeAndReturn(TokenType.AT, start, startLine, startCol, lineStart);
            case ':':
                return consumeAndReturn(TokenType.COLON, start, startLine, startCol, lineStart);
            case ',':
                return consumeAndReturn(TokenType.COMMA, start, startLine, startCol, lineStart);
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, start, startLine, startCol, lineStart);
            case '|':
                return consumeAndReturn(TokenType.BAR, start, startLine, startCol, lineStart);
            case '.':
                if (peekNext() == '.' && peekAt(position + 2) == '.') {
                    advance();
                    advance();
                    return consumeAndReturn(TokenType.ELLIPSIS, start, startLine, startCol, lineStart);
                }
                return consumeAndReturn(TokenType.DOT, start, startLine, startCol, lineStart);
            case '(':
                return consumeAndReturn(TokenType.LPAREN, start, startLine, startCol, lineStart);
            case ')':
                return consumeAndReturn(TokenType.RPAREN, start, startLine, startCol, lineStart);
            case '[':
                return consumeAndReturn(TokenType.LBRACKET, start, startLine, startCol, lineStart);
            case ']':
                return consumeAndReturn(TokenType.RBRACKET, start, startLine, startCol, lineStart);
            case '{':
                return consumeAndReturn(TokenType.LBRACE, start, startLine, startCol, lineStart);
            case '}':
                return consumeAndReturn(TokenType.RBRACE, start, startLine, startCol, lineStart);
            default:
                throw new LexicalException(startLine, startCol, "Invalid character '" + currentChar + "'");
        }
    }

    private Token readIdentifierOrKeyword(int start, int startLine, int startCol, boolean lineStart) {
        while (position < input.length() && isIdentifierPart(peek())) {
            advance();
        }
        String text = input.substring(start, position);
        TokenType keyword = keywords.get(text);
        if (keyword != null) {
            return makeToken(keyword, text, start, startLine, startCol, lineStart);
        }
        if (NameTranslator.isConstant(text)) {
            return makeToken(TokenType.CONSTANT, NameTranslator.translateConstant(text), start, startLine, startCol, lineStart);
        }
        return makeToken(TokenType.IDENTIFIER, NameTranslator.translate(text), start, startLine, startCol, lineStart);
    }

    private Token readNumber(int start, int startLine, int startCol, boolean lineStart) {
        TokenType type = TokenType.INTEGER;
        skipDigits();
        // 确认小数点后面还有数字，以区分 `srfi.1` 这样的库名
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            skipDigits();
            type = TokenType.DECIMAL;
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(position + 2))))) {
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            skipDigits();
            type = TokenType.DECIMAL;
        }
        if (peek() == 'i' && !isIdentifierPart(peekNext())) {
            advance();
            type = TokenType.IMAGINARY;
        }
        if (position < input.length() && isIdentifierPart(peek())) {
            throw new LexicalException(startLine, startCol,
                    "Malformed numeral '" + input.substring(start, position + 1) + "'");
        }
        String number = input.substring(start, position);
        return makeToken(type, number, start, startLine, startCol, lineStart);
    }

    private Token readPrefixedNumber(int start, int startLine, int startCol, boolean lineStart) {
        while (position < input.length() && !isNumeralDelimiter(peek())) {
            advance();
        }
        String numeral = input.substring(start, position);
        if (!SchemeNumeral.isValid(numeral)) {
            throw new LexicalException(startLine, startCol, "Malformed numeral '" + numeral + "'");
        }
        return makeToken(TokenType.PREFIXED_NUMBER, numeral, start, startLine, startCol, lineStart);
    }

    private Token readString(int start, int startLine, int startCol, boolean lineStart) {
        advance(); // 跳过起始的双引号
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (position >= input.length()) {
                throw new LexicalException(startLine, startCol, "Unterminated string literal");
            }
            char c = advance();
            if (c == '"') {
                break;
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (peek() == '\n' || (peek() == '\r' && peekNext() == '\n')) {
                skipStringContinuation();
                continue;
            }
            readEscapeSequence(sb, true, startLine, startCol);
        }
        return makeToken(TokenType.STRING, sb.toString(), start, startLine, startCol, lineStart);
    }

    /**
     * Backslash-newline: the newline and the next line's leading spaces vanish, and one
     * further backslash may mark where the string resumes.
     */
    private void skipStringContinuation() {
        if (peek() == '\r') {
            advance();
        }
        advance(); // '\n'
        while (peek() == ' ') {
            advance();
        }
        if (peek() == '\\') {
            advance();
        }
    }

    private Token readChar(int start, int startLine, int startCol, boolean lineStart) {
        advance(); // 跳过起始的单引号
        if (position >= input.length() || peek() == '\'' || peek() == '\n') {
            throw new LexicalException(startLine, startCol, "Empty or unterminated character literal");
        }
        int codePoint;
        if (peek() == '\\') {
            advance();
            StringBuilder sb = new StringBuilder();
            readEscapeSequence(sb, charHexTerminatorRequired, startLine, startCol);
            codePoint = sb.codePointAt(0);
        } else {
            codePoint = input.codePointAt(position);
            for (int i = 0; i < Character.charCount(codePoint); i++) {
                advance();
            }
        }
        if (peek() != '\'') {
            throw new LexicalException(startLine, startCol, "Unterminated character literal");
        }
        advance();
        return makeToken(TokenType.CHAR, codePoint, start, startLine, startCol, lineStart);
    }

    /**
     * Decodes the escape after a backslash into {@code sb}.
     */
    private void readEscapeSequence(StringBuilder sb, boolean hexTerminatorRequired, int startLine, int startCol) {
        if (position >= input.length()) {
            throw new LexicalException(startLine, startCol, "Unterminated escape sequence");
        }
        int escLine = line;
        int escCol = column - 1;
        char e = advance();
        switch (e) {
            case 'n' -> sb.append('\n');
            case 't' -> sb.append('\t');
            case 'r' -> sb.append('\r');
            case 'a' -> sb.append((char) 7);
            case 'b' -> sb.append('\b');
            case '\\', '\'', '"', '|' -> sb.append(e);
            case 'x' -> {
                int hexStart = position;
                while (isHexDigit(peek())) {
                    advance();
                }
                if (position == hexStart) {
                    throw new LexicalException(escLine, escCol, "Hex escape needs at least one hex digit");
                }
                int codePoint;
                try {
                    codePoint = Integer.parseInt(input.substring(hexStart, position), 16);
                } catch (NumberFormatException ex) {
                    throw new LexicalException(escLine, escCol, "Hex escape out of range", ex);
                }
                if (!Character.isValidCodePoint(codePoint)) {
                    throw new LexicalException(escLine, escCol, "Hex escape is not a valid code point");
                }
                if (peek() == ';') {
                    advance();
                } else if (hexTerminatorRequired) {
                    throw new LexicalException(escLine, escCol, "Hex escape must be terminated by ';'");
                }
                sb.appendCodePoint(codePoint);
            }
            default -> throw new LexicalException(escLine, escCol, "Invalid escape sequence '\\" + e + "'");
        }
    }

    private Token readEscape(int start, int startLine, int startCol, boolean lineStart) {
        advance(); // 跳过反斜杠
        ReadResult result;
        try {
            result = escapeDelegate.readOneDatum(input.subSequence(position, input.length()));
        } catch (DatumReadException e) {
            throw new LexicalException(startLine, startCol, "Escaped datum could not be read: " + e.getMessage(), e);
        }
        int consumed = result.consumedLength();
        if (consumed <= 0 || position + consumed > input.length()) {
            throw new LexicalException(startLine, startCol, "Escape delegate reported an invalid length " + consumed);
        }
        for (int i = 0; i < consumed; i++) {
            advance();
        }
        return makeToken(TokenType.ESCAPED_DATUM, result.datum(), start, startLine, startCol, lineStart);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ') {
                advance();
            } else if (ch == '\n') {
                advance();
                lineHasToken = false;
            } else if (ch == '\r' && peekNext() == '\n') {
                advance();
            } else if (ch == '-' && peekNext() == '-') {
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else if (ch == '{' && peekNext() == '-') {
                skipBlockComment();
            } else if (Character.isWhitespace(ch)) {
                String what = ch == '\t' ? "Tab characters are not allowed; indent with spaces" : "Unsupported whitespace character";
                throw new LexicalException(line, column, what);
            } else {
                break;
            }
        }
    }

    private void skipBlockComment() {
        int startLine = line;
        int startCol = column;
        int depth = 0;
        do {
            if (position >= input.length()) {
                throw new LexicalException(startLine, startCol, "Unterminated block comment");
            }
            if (peek() == '{' && peekNext() == '-') {
                depth++;
                advance();
                advance();
            } else if (peek() == '-' && peekNext() == '}') {
                depth--;
                advance();
                advance();
            } else {
                if (advance() == '\n') {
                    lineHasToken = false;
                }
            }
        } while (depth > 0);
    }

    private void skipDigits() {
        while (isDigit(peek())) {
            advance();
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        return peekAt(position + 1);
    }

    private char peekAt(int index) {
        if (index >= input.length()) return '\0';
        return input.charAt(index);
    }

    private char advance() {
        char c = input.charAt(position++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private Token consumeAndReturn(TokenType type, int start, int startLine, int startCol, boolean lineStart) {
        advance();
        return makeToken(type, input.substring(start, position), start, startLine, startCol, lineStart);
    }

    private Token makeToken(TokenType type, Object value, int start, int startLine, int startCol, boolean lineStart) {
        lineHasToken = true;
        return new Token(type, input.substring(start, position), value, startLine, startCol, start, position, lineStart, false);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private boolean isNumeralDelimiter(char c) {
        return Character.isWhitespace(c) || "()[]{},;|\"".indexOf(c) >= 0;
    }
}
