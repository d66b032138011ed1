package org.csu.algolisp.engine;

/**
 * How a trailing {@code @rest} in a list or vector constructor is desugared.
 */
public enum SpliceStyle {
    /** [a, @r] becomes (apply list a r) */
    APPLY,
    /** [a, @r] becomes (cons* a r) */
    CONS_STAR;

    public static SpliceStyle fromText(String text) {
        return switch (text.trim().toLowerCase()) {
            case "apply" -> APPLY;
            case "cons-star", "cons*" -> CONS_STAR;
            default -> throw new IllegalArgumentException("Unknown splice style: " + text + " (expected apply or cons-star)");
        };
    }
}
