package com.secondhand.persistence;

/**
 * A persisted record can't be restored. The loader drops the record and moves on.
 */
public class CorruptRecordException extends Exception {

    public CorruptRecordException(String message) {
        super(message);
    }

    public CorruptRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
