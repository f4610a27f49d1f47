package com.example.AssessRec.exception;

/**
 * A catalog, ground truth or query file could not be read or has an unsupported layout.
 */
public class DatasetFormatException extends AssessRecException {

    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
