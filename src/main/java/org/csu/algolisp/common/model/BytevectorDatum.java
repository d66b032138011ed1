package org.csu.algolisp.common.model;

import java.util.List;

/**
 * {@code #u8(...)}; every element is in 0..255.
 */
public record BytevectorDatum(List<Integer> bytes) implements Datum {

    public BytevectorDatum {
        bytes = List.copyOf(bytes);
        for (int b : bytes) {
            if (b < 0 || b > 255) {
                throw new IllegalArgumentException("Bytevector element out of range: " + b);
            }
        }
    }

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
