package org.csu.algolisp.common.model;

public record BooleanDatum(boolean value) implements Datum {

    public static final BooleanDatum TRUE = new BooleanDatum(true);
    public static final BooleanDatum FALSE = new BooleanDatum(false);

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
