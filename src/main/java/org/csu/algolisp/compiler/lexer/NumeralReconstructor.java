package org.csu.algolisp.compiler.lexer;

import org.csu.algolisp.common.exception.LexicalException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rebuilds signed, rational, rectangular and polar numerals from adjacent raw tokens.
 * Only tokens with no whitespace between them are merged; anything else stays an operator.
 */
public final class NumeralReconstructor {

    private static final Set<TokenType> OPERAND_ENDS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.CONSTANT, TokenType.INTEGER, TokenType.DECIMAL,
            TokenType.RATIONAL, TokenType.IMAGINARY, TokenType.COMPLEX, TokenType.PREFIXED_NUMBER,
            TokenType.STRING, TokenType.CHAR, TokenType.ESCAPED_DATUM, TokenType.TRUE, TokenType.FALSE,
            TokenType.ELLIPSIS, TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE);

    private static final Set<TokenType> REALS = EnumSet.of(
            TokenType.INTEGER, TokenType.DECIMAL, TokenType.RATIONAL);

    // 会改变复数字面量含义的相邻运算符
    private static final Set<TokenType> ARITHMETIC = EnumSet.of(
            TokenType.PLUS, TokenType.MINUS, TokenType.STAR, TokenType.SLASH, TokenType.AT, TokenType.COLON);

    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("[0-9]+");
    private static final Pattern UNSIGNED_INTEGER_IMAGINARY = Pattern.compile("[0-9]+i");

    private NumeralReconstructor() {
    }

    public static List<Token> reconstruct(List<Token> raw) {
        List<Token> tokens = mergeSigns(raw);
        tokens = mergeRationals(tokens);
        tokens = mergeComplex(tokens);
        return mergePolar(tokens);
    }

    private static List<Token> mergeSigns(List<Token> in) {
        List<Token> out = new ArrayList<>(in.size());
        for (int i = 0; i < in.size(); i++) {
            Token t = in.get(i);
            if ((t.type() == TokenType.PLUS || t.type() == TokenType.MINUS) && i + 1 < in.size()) {
                Token next = in.get(i + 1);
                boolean unsignedNumber = next.type() == TokenType.INTEGER
                        || next.type() == TokenType.DECIMAL
                        || next.type() == TokenType.IMAGINARY;
                boolean prefixPosition = out.isEmpty() || !OPERAND_ENDS.contains(out.get(out.size() - 1).type());
                if (unsignedNumber && t.touches(next) && prefixPosition) {
                    out.add(merge(next.type(), t, next));
                    i++;
                    continue;
                }
            }
            out.add(t);
        }
        return out;
    }

    private static List<Token> mergeRationals(List<Token> in) {
        List<Token> out = new ArrayList<>(in.size());
        for (int i = 0; i < in.size(); i++) {
            Token t = in.get(i);
            if (t.type() == TokenType.INTEGER && i + 2 < in.size()) {
                Token slash = in.get(i + 1);
                Token denominator = in.get(i + 2);
                TokenType merged = null;
                if (denominator.type() == TokenType.INTEGER && UNSIGNED_INTEGER.matcher(denominator.lexeme()).matches()) {
                    merged = TokenType.RATIONAL;
                } else if (denominator.type() == TokenType.IMAGINARY
                        && UNSIGNED_INTEGER_IMAGINARY.matcher(denominator.lexeme()).matches()) {
                    merged = TokenType.IMAGINARY;
                }
                if (merged != null && slash.type() == TokenType.SLASH && t.touches(slash) && slash.touches(denominator)) {
                    Token previous = out.isEmpty() ? null : out.get(out.size() - 1);
                    if (previous != null && previous.type() == TokenType.SLASH && previous.touches(t)) {
                        throw ambiguous(previous);
                    }
                    Token rational = merge(merged, t, slash, denominator);
                    checkFollower(in, i + 3, rational, EnumSet.of(TokenType.SLASH));
                    out.add(rational);
                    i += 2;
                    continue;
                }
            }
            out.add(t);
        }
        return out;
    }

    private static List<Token> mergeComplex(List<Token> in) {
        List<Token> out = new ArrayList<>(in.size());
        for (int i = 0; i < in.size(); i++) {
            Token t = in.get(i);
            if (REALS.contains(t.type()) && i + 2 < in.size()) {
                Token sign = in.get(i + 1);
                Token imaginary = in.get(i + 2);
                if ((sign.type() == TokenType.PLUS || sign.type() == TokenType.MINUS)
                        && imaginary.type() == TokenType.IMAGINARY
                        && !isSigned(imaginary)
                        && t.touches(sign) && sign.touches(imaginary)) {
                    checkPredecessor(out, t);
                    Token complex = merge(TokenType.COMPLEX, t, sign, imaginary);
                    checkFollower(in, i + 3, complex, ARITHMETIC);
                    out.add(complex);
                    i += 2;
                    continue;
                }
            }
            out.add(t);
        }
        return out;
    }

    private static List<Token> mergePolar(List<Token> in) {
        List<Token> out = new ArrayList<>(in.size());
        for (int i = 0; i < in.size(); i++) {
            Token t = in.get(i);
            if (REALS.contains(t.type()) && i + 2 < in.size()) {
                Token at = in.get(i + 1);
                Token angle = in.get(i + 2);
                if (at.type() == TokenType.AT && REALS.contains(angle.type())
                        && t.touches(at) && at.touches(angle)) {
                    checkPredecessor(out, t);
                    Token polar = merge(TokenType.COMPLEX, t, at, angle);
                    checkFollower(in, i + 3, polar, ARITHMETIC);
                    out.add(polar);
                    i += 2;
                    continue;
                }
            }
            out.add(t);
        }
        return out;
    }

    private static void checkPredecessor(List<Token> out, Token first) {
        if (out.isEmpty()) {
            return;
        }
        Token previous = out.get(out.size() - 1);
        if (ARITHMETIC.contains(previous.type()) && previous.touches(first)) {
            throw ambiguous(previous);
        }
    }

    private static void checkFollower(List<Token> in, int index, Token merged, Set<TokenType> operators) {
        if (index >= in.size()) {
            return;
        }
        Token next = in.get(index);
        if (operators.contains(next.type()) && merged.touches(next)) {
            throw ambiguous(merged);
        }
    }

    private static LexicalException ambiguous(Token at) {
        return new LexicalException(at.line(), at.column(),
                "Ambiguous numeral; separate the operator with spaces or parentheses");
    }

    private static boolean isSigned(Token number) {
        char first = number.lexeme().charAt(0);
        return first == '+' || first == '-';
    }

    private static Token merge(TokenType type, Token first, Token... rest) {
        StringBuilder lexeme = new StringBuilder(first.lexeme());
        Token last = first;
        for (Token t : rest) {
            lexeme.append(t.lexeme());
            last = t;
        }
        return new Token(type, lexeme.toString(), lexeme.toString(), first.line(), first.column(),
                first.offset(), last.end(), first.lineStart(), false);
    }
}
