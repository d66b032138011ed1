package org.csu.algolisp.reader;

import lombok.Getter;

/**
 * A malformed datum; {@code offset} is relative to the input handed to the reader.
 */
@Getter
public class DatumReadException extends RuntimeException {

    private final int offset;

    public DatumReadException(int offset, String message) {
        super(message);
        this.offset = offset;
    }
}
