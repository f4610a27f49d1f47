package com.example.AssessRec.exception;

/**
 * Base type for failures raised by the retrieval, recommendation and evaluation core.
 */
public class AssessRecException extends RuntimeException {

    public AssessRecException(String message) {
        super(message);
    }

    public AssessRecException(String message, Throwable cause) {
        super(message, cause);
    }
}
