package com.example.AssessRec.exception;

/**
 * Failure of the external text generation step. Never escapes the recommendation service.
 */
public class ExplanationGenerationException extends AssessRecException {

    public ExplanationGenerationException(String message) {
        super(message);
    }

    public ExplanationGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
