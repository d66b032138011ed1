package org.csu.algolisp.reader;

/**
 * The host reader consulted when the lexer meets a {@code \} escape.
 * <p>
 * Implementations read exactly one datum from the start of {@code remainingInput} and
 * report how many characters it occupied. They signal malformed input with
 * {@link DatumReadException}; the lexer reports that as a lexical error at the escape.
 */
@FunctionalInterface
public interface EscapeDelegate {

    ReadResult readOneDatum(CharSequence remainingInput);
}
