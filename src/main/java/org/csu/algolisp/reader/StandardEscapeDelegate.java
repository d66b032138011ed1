package org.csu.algolisp.reader;

import org.csu.algolisp.common.model.Datum;

/**
 * Escape delegate backed by {@link DatumReader}.
 */
public class StandardEscapeDelegate implements EscapeDelegate {

    @Override
    public ReadResult readOneDatum(CharSequence remainingInput) {
        DatumReader reader = new DatumReader(remainingInput);
        Datum datum = reader.read();
        if (datum == null) {
            throw new DatumReadException(reader.getPosition(), "Expected a datum after the escape, but found end of input");
        }
        return new ReadResult(datum, reader.getPosition());
    }
}
