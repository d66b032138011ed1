package org.csu.algolisp.engine;

import org.csu.algolisp.common.model.Datum;
import org.csu.algolisp.common.model.DatumPrinter;

import java.util.List;

/**
 * Canonical forms produced for one unit.
 */
public record TranslationResult(List<Datum> forms) {

    public TranslationResult {
        forms = List.copyOf(forms);
    }

    /**
     * 每个顶层形式一行
     */
    public String toText() {
        return DatumPrinter.printAll(forms);
    }
}
