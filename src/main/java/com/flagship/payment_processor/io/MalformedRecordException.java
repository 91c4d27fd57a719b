package com.flagship.payment_processor.io;

/**
 * Thrown for an input row that cannot even be read as a record: unparseable numbers,
 * missing ids, or ids out of range. The row is skipped.
 */
public class MalformedRecordException extends IllegalArgumentException {

    public MalformedRecordException(long line, String message) {
        super(String.format("line %d: %s", line, message));
    }

    public MalformedRecordException(long line, String message, Throwable cause) {
        super(String.format("line %d: %s", line, message), cause);
    }
}
