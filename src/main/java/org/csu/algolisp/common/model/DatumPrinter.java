package org.csu.algolisp.common.model;

import org.csu.algolisp.reader.SchemeNumeral;

import java.util.List;
import java.util.Map;

/**
 * 将 Datum 格式化为标准的外部表示 (external representation)。
 * The output is readable back by {@link org.csu.algolisp.reader.DatumReader}.
 */
public class DatumPrinter {

    private static final Map<Integer, String> CHAR_NAMES = Map.of(
            0, "null",
            7, "alarm",
            8, "backspace",
            9, "tab",
            10, "newline",
            13, "return",
            27, "escape",
            32, "space",
            127, "delete");

    private static final Map<String, String> QUOTE_PREFIXES = Map.of(
            "quote", "'",
            "quasiquote", "`",
            "unquote", ",",
            "unquote-splicing", ",@");

    private DatumPrinter() {
    }

    public static String print(Datum datum) {
        StringBuilder sb = new StringBuilder();
        print(datum, sb);
        return sb.toString();
    }

    /**
     * Prints each form on its own line.
     */
    public static String printAll(List<Datum> data) {
        StringBuilder sb = new StringBuilder();
        for (Datum datum : data) {
            print(datum, sb);
            sb.append('\n');
        }
        return sb.toString();
    }

    public static void print(Datum datum, StringBuilder sb) {
        if (datum instanceof SymbolDatum symbol) {
            printSymbol(symbol.name(), sb);
        } else if (datum instanceof StringDatum string) {
            printString(string.value(), sb);
        } else if (datum instanceof CharDatum ch) {
            printChar(ch.codePoint(), sb);
        } else if (datum instanceof NumberDatum number) {
            sb.append(number.text());
        } else if (datum instanceof BooleanDatum bool) {
            sb.append(bool.value() ? "#t" : "#f");
        } else if (datum instanceof ListDatum list) {
            printList(list, sb);
        } else if (datum instanceof VectorDatum vector) {
            sb.append('#');
            printSequence(vector.items(), sb);
        } else if (datum instanceof BytevectorDatum bytevector) {
            sb.append("#u8(");
            for (int i = 0; i < bytevector.bytes().size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(bytevector.bytes().get(i));
            }
            sb.append(')');
        } else {
            throw new IllegalArgumentException("Unknown datum: " + datum.getClass().getSimpleName());
        }
    }

    private static void printList(ListDatum list, StringBuilder sb) {
        if (list.isProper() && list.items().size() == 2
                && list.head() instanceof SymbolDatum head
                && QUOTE_PREFIXES.containsKey(head.name())) {
            sb.append(QUOTE_PREFIXES.get(head.name()));
            print(list.items().get(1), sb);
            return;
        }
        sb.append('(');
        for (int i = 0; i < list.items().size(); i++) {
            if (i > 0) sb.append(' ');
            print(list.items().get(i), sb);
        }
        if (list.tail() != null) {
            sb.append(" . ");
            print(list.tail(), sb);
        }
        sb.append(')');
    }

    private static void printSequence(List<Datum> items, StringBuilder sb) {
        sb.append('(');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(' ');
            print(items.get(i), sb);
        }
        sb.append(')');
    }

    private static void printSymbol(String name, StringBuilder sb) {
        if (!needsBars(name)) {
            sb.append(name);
            return;
        }
        sb.append('|');
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '|' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('|');
    }

    private static boolean needsBars(String name) {
        if (name.isEmpty() || name.equals(".") || name.charAt(0) == '#' || SchemeNumeral.isValid(name)) {
            return true;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || "()[]{}|\"';`,".indexOf(c) >= 0) {
                return true;
            }
        }
        return false;
    }

    private static void printString(String value, StringBuilder sb) {
        sb.append('"');
        value.codePoints().forEach(cp -> {
            switch (cp) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case 7 -> sb.append("\\a");
                case 8 -> sb.append("\\b");
                default -> {
                    if (Character.isISOControl(cp)) {
                        sb.append("\\x").append(Integer.toHexString(cp)).append(';');
                    } else {
                        sb.appendCodePoint(cp);
                    }
                }
            }
        });
        sb.append('"');
    }

    private static void printChar(int codePoint, StringBuilder sb) {
        sb.append("#\\");
        String name = CHAR_NAMES.get(codePoint);
        if (name != null) {
            sb.append(name);
        } else if (Character.isISOControl(codePoint) || Character.isWhitespace(codePoint)) {
            sb.append('x').append(Integer.toHexString(codePoint));
        } else {
            sb.appendCodePoint(codePoint);
        }
    }
}
