package org.csu.algolisp.common.model;

import java.util.Arrays;
import java.util.List;

/**
 * A canonical S-expression value, the output of the emitter and the
 * currency of the escape delegate. Every implementation is immutable.
 */
public interface Datum {

    ListDatum EMPTY = new ListDatum(List.of(), null);

    static SymbolDatum symbol(String name) {
        return new SymbolDatum(name);
    }

    static ListDatum list(Datum... items) {
        return new ListDatum(Arrays.asList(items), null);
    }

    static ListDatum list(List<? extends Datum> items) {
        return new ListDatum(List.copyOf(items), null);
    }

    static ListDatum quote(Datum datum) {
        return list(symbol("quote"), datum);
    }
}
