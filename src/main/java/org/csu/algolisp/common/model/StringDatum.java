package org.csu.algolisp.common.model;

public record StringDatum(String value) implements Datum {

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
