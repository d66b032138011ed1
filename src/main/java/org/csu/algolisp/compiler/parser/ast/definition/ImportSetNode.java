package org.csu.algolisp.compiler.parser.ast.definition;

import org.csu.algolisp.common.model.Datum;

import java.util.List;

/**
 * Recursive import set. A LIBRARY node carries {@code libraryName}; every other node wraps
 * {@code inner}, the set written to its left.
 *
 * @param names      identifiers for EXPOSING and HIDING
 * @param renamings  pairs for RENAMING
 * @param qualifier  prefix name for QUALIFYING
 */
public record ImportSetNode(
        ImportModifier modifier,
        ImportSetNode inner,
        List<Datum> libraryName,
        List<String> names,
        List<RenamingNode> renamings,
        String qualifier
) {

    public static ImportSetNode library(List<Datum> libraryName) {
        return new ImportSetNode(ImportModifier.LIBRARY, null, List.copyOf(libraryName), List.of(), List.of(), null);
    }

    public ImportSetNode exposing(List<String> identifiers) {
        return new ImportSetNode(ImportModifier.EXPOSING, this, List.of(), List.copyOf(identifiers), List.of(), null);
    }

    public ImportSetNode hiding(List<String> identifiers) {
        return new ImportSetNode(ImportModifier.HIDING, this, List.of(), List.copyOf(identifiers), List.of(), null);
    }

    public ImportSetNode renaming(List<RenamingNode> pairs) {
        return new ImportSetNode(ImportModifier.RENAMING, this, List.of(), List.of(), List.copyOf(pairs), null);
    }

    public ImportSetNode qualifying(String prefix) {
        return new ImportSetNode(ImportModifier.QUALIFYING, this, List.of(), List.of(), List.of(), prefix);
    }
}
