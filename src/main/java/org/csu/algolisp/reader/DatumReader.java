package org.csu.algolisp.reader;

import lombok.Getter;
import org.csu.algolisp.common.model.BooleanDatum;
import org.csu.algolisp.common.model.BytevectorDatum;
import org.csu.algolisp.common.model.CharDatum;
import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.ListDatum;
import org.csu.algolisp.common.model.NumberDatum;
import org.csu.algolisp.common.model.StringDatum;
import org.csu.algolisp.common.model.SymbolDatum;
import org.csu.algolisp.common.model.VectorDatum;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reader for the standard Scheme datum syntax: lists and dotted pairs, vectors,
 * bytevectors, quote abbreviations, strings, characters, booleans, numbers and symbols.
 */
public class DatumReader {

    private static final Map<String, Integer> CHAR_NAMES = Map.of(
            "alarm", 7,
            "backspace", 8,
            "delete", 127,
            "escape", 27,
            "newline", 10,
            "null", 0,
            "return", 13,
            "space", 32,
            "tab", 9);

    private static final Map<Character, String> ABBREVIATIONS = Map.of(
            '\'', "quote",
            '`', "quasiquote",
            ',', "unquote");

    private final CharSequence input;
    @Getter
    private int position = 0;

    public DatumReader(CharSequence input) {
        this.input = input;
    }

    /**
     * Reads the next datum, or returns null at end of input.
     */
    public Datum read() {
        skipAtmosphere();
        if (isAtEnd()) {
            return null;
        }
        return readDatum();
    }

    public List<Datum> readAll() {
        List<Datum> data = new ArrayList<>();
        Datum datum;
        while ((datum = read()) != null) {
            data.add(datum);
        }
        return data;
    }

    private Datum readDatum() {
        skipAtmosphere();
        if (isAtEnd()) {
            throw error("Unexpected end of input, expected a datum");
        }
        char c = peek();
        switch (c) {
            case '(':
            case '[':
                advance();
                return readListTail(c == '(' ? ')' : ']');
            case ')':
            case ']':
                throw error("Unexpected '" + c + "'");
            case '"':
                advance();
                return new StringDatum(readString());
            case '|':
                advance();
                return new SymbolDatum(readBarSymbol());
            case '\'':
            case '`':
                advance();
                return Datum.list(Datum.symbol(ABBREVIATIONS.get(c)), readDatum());
            case ',':
                advance();
                if (!isAtEnd() && peek() == '@') {
                    advance();
                    return Datum.list(Datum.symbol("unquote-splicing"), readDatum());
                }
                return Datum.list(Datum.symbol("unquote"), readDatum());
            case '#':
                return readHash();
            default:
                return readAtom();
        }
    }

    private Datum readListTail(char close) {
        List<Datum> items = new ArrayList<>();
        while (true) {
            skipAtmosphere();
            if (isAtEnd()) {
                throw error("Unterminated list");
            }
            char c = peek();
            if (c == close) {
                advance();
                return new ListDatum(items, null);
            }
            if (c == '.' && isDelimiter(peekAt(position + 1))) {
                if (items.isEmpty()) {
                    throw error("A dotted list needs at least one item before '.'");
                }
                advance();
                Datum tail = readDatum();
                skipAtmosphere();
                if (isAtEnd() || peek() != close) {
                    throw error("Expected '" + close + "' after the tail of a dotted list");
                }
                advance();
                return new ListDatum(items, tail);
            }
            items.add(readDatum());
        }
    }

    private Datum readHash() {
        char next = peekAt(position + 1);
        if (next == '(') {
            position += 2;
            ListDatum items = (ListDatum) readListTail(')');
            return new VectorDatum(items.items());
        }
        if (next == '\\') {
            position += 2;
            return readChar();
        }
        if (next == 'u' && peekAt(position + 2) == '8' && peekAt(position + 3) == '(') {
            int start = position;
            position += 4;
            ListDatum items = (ListDatum) readListTail(')');
            List<Integer> bytes = new ArrayList<>();
            for (Datum item : items.items()) {
                int value = item instanceof NumberDatum number ? byteValue(number.text()) : -1;
                if (value < 0) {
                    throw new DatumReadException(start, "Bytevector elements must be exact integers in 0..255, found " + item);
                }
                bytes.add(value);
            }
            return new BytevectorDatum(bytes);
        }
        int start = position;
        String atom = readAtomText();
        switch (atom) {
            case "#t", "#true":
                return BooleanDatum.TRUE;
            case "#f", "#false":
                return BooleanDatum.FALSE;
            default:
                if (SchemeNumeral.isValid(atom)) {
                    return new NumberDatum(atom);
                }
                throw new DatumReadException(start, "Bad '#' syntax: " + atom);
        }
    }

    private Datum readChar() {
        int start = position;
        if (isAtEnd()) {
            throw error("Unterminated character literal");
        }
        int first = Character.codePointAt(input, position);
        position += Character.charCount(first);
        while (!isAtEnd() && !isDelimiter(peek())) {
            position++;
        }
        String text = input.subSequence(start, position).toString();
        if (text.codePointCount(0, text.length()) == 1) {
            return new CharDatum(first);
        }
        Integer named = CHAR_NAMES.get(text);
        if (named != null) {
            return new CharDatum(named);
        }
        if (text.charAt(0) == 'x' && text.substring(1).matches("[0-9a-fA-F]+")) {
            return new CharDatum(codePoint(text.substring(1), start));
        }
        throw new DatumReadException(start, "Unknown character name: #\\" + text);
    }

    private String readString() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated string");
            }
            char c = advance();
            if (c == '"') {
                return sb.toString();
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) {
                throw error("Unterminated string");
            }
            char e = advance();
            switch (e) {
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 't' -> sb.append('\t');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case '"', '\\', '|' -> sb.append(e);
                case 'x' -> sb.appendCodePoint(readHexScalar());
                case ' ', '\n' -> {
                    position--;
                    skipLineContinuation();
                }
                default -> throw error("Invalid escape \\" + e + " in string");
            }
        }
    }

    private void skipLineContinuation() {
        while (!isAtEnd() && peek() == ' ') {
            position++;
        }
        if (isAtEnd() || peek() != '\n') {
            throw error("Invalid escape in string");
        }
        position++;
        while (!isAtEnd() && peek() == ' ') {
            position++;
        }
    }

    private String readBarSymbol() {
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw error("Unterminated |symbol|");
            }
            char c = advance();
            if (c == '|') {
                return sb.toString();
            }
            if (c == '\\') {
                if (isAtEnd()) {
                    throw error("Unterminated |symbol|");
                }
                char e = advance();
                if (e == 'x') {
                    sb.appendCodePoint(readHexScalar());
                } else {
                    sb.append(e);
                }
            } else {
                sb.append(c);
            }
        }
    }

    private int readHexScalar() {
        int start = position;
        while (!isAtEnd() && isHexDigit(peek())) {
            position++;
        }
        if (position == start || isAtEnd() || peek() != ';') {
            throw new DatumReadException(start, "Hex escape must be hex digits followed by ';'");
        }
        int value = codePoint(input.subSequence(start, position).toString(), start);
        position++;
        return value;
    }

    private static int codePoint(String hex, int offset) {
        String digits = hex.replaceFirst("^0+(?=.)", "");
        int value = digits.length() > 6 ? -1 : Integer.parseInt(digits, 16);
        if (!Character.isValidCodePoint(value)) {
            throw new DatumReadException(offset, "Hex scalar " + hex + " is not a valid code point");
        }
        return value;
    }

    // -1 为非法字节
    private static int byteValue(String text) {
        String digits = text.replaceFirst("^0+(?=.)", "");
        if (!digits.matches("[0-9]{1,3}")) {
            return -1;
        }
        int value = Integer.parseInt(digits);
        return value <= 255 ? value : -1;
    }

    private static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private Datum readAtom() {
        int start = position;
        String atom = readAtomText();
        if (atom.isEmpty()) {
            throw new DatumReadException(start, "Unexpected character '" + peek() + "'");
        }
        if (atom.equals(".")) {
            throw new DatumReadException(start, "Unexpected '.'");
        }
        if (SchemeNumeral.isValid(atom)) {
            return new NumberDatum(atom);
        }
        return new SymbolDatum(atom);
    }

    private String readAtomText() {
        int start = position;
        while (!isAtEnd() && !isDelimiter(peek())) {
            position++;
        }
        return input.subSequence(start, position).toString();
    }

    private void skipAtmosphere() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                position++;
            } else if (c == ';') {
                while (!isAtEnd() && peek() != '\n') {
                    position++;
                }
            } else if (c == '#' && peekAt(position + 1) == '|') {
                skipBlockComment();
            } else if (c == '#' && peekAt(position + 1) == ';') {
                position += 2;
                readDatum();
            } else {
                return;
            }
        }
    }

    private void skipBlockComment() {
        int start = position;
        int depth = 0;
        do {
            if (isAtEnd()) {
                throw new DatumReadException(start, "Unterminated #| comment");
            }
            if (peek() == '#' && peekAt(position + 1) == '|') {
                depth++;
                position += 2;
            } else if (peek() == '|' && peekAt(position + 1) == '#') {
                depth--;
                position += 2;
            } else {
                position++;
            }
        } while (depth > 0);
    }

    private static boolean isDelimiter(char c) {
        return c == '\0' || Character.isWhitespace(c) || "()[]{}\";'`,|".indexOf(c) >= 0;
    }

    private DatumReadException error(String message) {
        return new DatumReadException(position, message);
    }

    // --- 辅助方法 ---

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        return input.charAt(position);
    }

    private char peekAt(int index) {
        if (index >= input.length()) return '\0';
        return input.charAt(index);
    }

    private char advance() {
        return input.charAt(position++);
    }
}
