package org.csu.algolisp.reader;

import java.util.Locale;

/**
 * Recognizer for the R7RS numeral syntax: optional radix/exactness prefixes followed by
 * an integer, rational, decimal, rectangular or polar complex number.
 */
public final class SchemeNumeral {

    private final String text;
    private final int radix;

    private SchemeNumeral(String text, int radix) {
        this.text = text;
        this.radix = radix;
    }

    /**
     * Whether {@code text} starts with one of {@code #b #o #d #x #e #i}.
     */
    public static boolean hasPrefix(CharSequence text, int start) {
        if (start + 1 >= text.length() || text.charAt(start) != '#') {
            return false;
        }
        return "bodxeiBODXEI".indexOf(text.charAt(start + 1)) >= 0;
    }

    public static boolean isValid(String numeral) {
        String lower = numeral.toLowerCase(Locale.ROOT);
        int position = 0;
        int radix = 10;
        boolean radixSeen = false;
        boolean exactnessSeen = false;
        while (position + 1 < lower.length() && lower.charAt(position) == '#') {
            char marker = lower.charAt(position + 1);
            switch (marker) {
                case 'b', 'o', 'd', 'x' -> {
                    if (radixSeen) return false;
                    radixSeen = true;
                    radix = switch (marker) {
                        case 'b' -> 2;
                        case 'o' -> 8;
                        case 'x' -> 16;
                        default -> 10;
                    };
                }
                case 'e', 'i' -> {
                    if (exactnessSeen) return false;
                    exactnessSeen = true;
                }
                default -> {
                    return false;
                }
            }
            position += 2;
        }
        String body = lower.substring(position);
        return !body.isEmpty() && new SchemeNumeral(body, radix).complex();
    }

    private boolean complex() {
        int end = text.length();
        if ((text.equals("+i") || text.equals("-i"))) {
            return true;
        }
        int p = real(0);
        if (p < 0) {
            return false;
        }
        if (p == end) {
            return true;
        }
        char c = text.charAt(p);
        if (c == '@') {
            return real(p + 1) == end;
        }
        if (c == 'i') {
            // pure imaginary needs an explicit sign, e.g. +2i
            return p + 1 == end && isSign(text.charAt(0));
        }
        if (isSign(c)) {
            int q = p + 1;
            if (q < end && text.charAt(q) == 'i') {
                return q + 1 == end;
            }
            int r = infNan(q);
            if (r < 0) {
                r = ureal(q);
            }
            return r > 0 && r + 1 == end && text.charAt(r) == 'i';
        }
        return false;
    }

    private int real(int p) {
        if (p < text.length() && isSign(text.charAt(p))) {
            int r = infNan(p + 1);
            if (r > 0) {
                return r;
            }
            return ureal(p + 1);
        }
        return ureal(p);
    }

    private int infNan(int p) {
        if (text.startsWith("inf.0", p) || text.startsWith("nan.0", p)) {
            return p + 5;
        }
        return -1;
    }

    private int ureal(int p) {
        int q = uinteger(p);
        if (q > 0 && q < text.length() && text.charAt(q) == '/') {
            return uinteger(q + 1);
        }
        if (radix == 10) {
            int d = decimal(p);
            if (d > q) {
                return d;
            }
        }
        return q;
    }

    private int uinteger(int p) {
        int q = p;
        while (q < text.length() && isDigit(text.charAt(q), radix)) {
            q++;
        }
        return q > p ? q : -1;
    }

    private int decimal(int p) {
        int q = p;
        int digits = 0;
        while (q < text.length() && isDigit(text.charAt(q), 10)) {
            q++;
            digits++;
        }
        if (q < text.length() && text.charAt(q) == '.') {
            q++;
            while (q < text.length() && isDigit(text.charAt(q), 10)) {
                q++;
                digits++;
            }
        }
        if (digits == 0) {
            return -1;
        }
        if (q < text.length() && text.charAt(q) == 'e') {
            int e = q + 1;
            if (e < text.length() && isSign(text.charAt(e))) {
                e++;
            }
            int exponentEnd = uintegerDecimal(e);
            if (exponentEnd < 0) {
                return -1;
            }
            q = exponentEnd;
        }
        return q;
    }

    private int uintegerDecimal(int p) {
        int q = p;
        while (q < text.length() && isDigit(text.charAt(q), 10)) {
            q++;
        }
        return q > p ? q : -1;
    }

    // 只接受 ASCII 数字
    private static boolean isDigit(char c, int radix) {
        return c < 128 && Character.digit(c, radix) >= 0;
    }

    private static boolean isSign(char c) {
        return c == '+' || c == '-';
    }
}
