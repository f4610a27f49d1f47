package com.example.AssessRec.exception;

public class EmbeddingDimensionMismatchException extends AssessRecException {

    public EmbeddingDimensionMismatchException(int expected, int actual) {
        super("Embedding dimension mismatch: index expects " + expected + " but got " + actual);
    }
}
