package org.csu.algolisp.common.model;

import java.util.List;

/**
 * A list. When {@code tail} is not null the list is improper: {@code (a b . tail)}.
 */
public record ListDatum(List<Datum> items, Datum tail) implements Datum {

    public ListDatum {
        items = List.copyOf(items);
        if (tail != null && items.isEmpty()) {
            throw new IllegalArgumentException("An improper list needs at least one item before the tail");
        }
    }

    public boolean isEmpty() {
        return items.isEmpty() && tail == null;
    }

    public boolean isProper() {
        return tail == null;
    }

    public Datum head() {
        return items.isEmpty() ? null : items.get(0);
    }

    @Override
    public String toString() {
        return DatumPrinter.print(this);
    }
}
