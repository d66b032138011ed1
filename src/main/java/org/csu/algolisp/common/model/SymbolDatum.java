package org.csu.algolisp.common.model;

public record SymbolDatum(String name) implements Datum {

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
