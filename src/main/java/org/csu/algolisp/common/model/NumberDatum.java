package org.csu.algolisp.common.model;

/**
 * A number kept in its exact external representation, e.g. {@code 3+4i}, {@code #x1f}.
 * The translator never evaluates numerals.
 */
public record NumberDatum(String text) implements Datum {

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
