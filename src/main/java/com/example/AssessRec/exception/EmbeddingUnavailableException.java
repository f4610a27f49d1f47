package com.example.AssessRec.exception;

/**
 * The embedding model could not be called or returned no vector.
 */
public class EmbeddingUnavailableException extends AssessRecException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
