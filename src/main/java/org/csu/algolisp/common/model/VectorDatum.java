package org.csu.algolisp.common.model;

import java.util.List;

public record VectorDatum(List<Datum> items) implements Datum {

    public VectorDatum {
        items = List.copyOf(items);
    }

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
