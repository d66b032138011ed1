package org.csu.algolisp.common.model;

/**
 * A character, held as a Unicode code point.
 */
public record CharDatum(int codePoint) implements Datum {

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
