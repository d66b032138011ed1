package org.csu.algolisp.reader;

import org.csu.algolisp.common.model.Datum;

/**
 * @param datum          the datum that was read
 * @param consumedLength number of input characters it occupied, including leading atmosphere
 */
public record ReadResult(Datum datum, int consumedLength) {
}
