package org.csu.algolisp.engine;

/**
 * What a guard does with a condition none of its clauses accepts.
 */
public enum GuardPolicy {
    /** append (else (raise-continuable var)) when there is no catch-all clause */
    RERAISE,
    /** reject a guard without a catch-all clause */
    REQUIRE_CATCH_ALL;

    public static GuardPolicy fromText(String text) {
        return switch (text.trim().toLowerCase()) {
            case "reraise" -> RERAISE;
            case "require-catch-all" -> REQUIRE_CATCH_ALL;
            default -> throw new IllegalArgumentException("Unknown guard policy: " + text + " (expected reraise or require-catch-all)");
        };
    }
}
