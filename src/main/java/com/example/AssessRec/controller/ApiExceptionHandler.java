package com.example.AssessRec.controller;

import com.example.AssessRec.exception.CatalogIndexNotBuiltException;
import com.example.AssessRec.exception.DatasetFormatException;
import com.example.AssessRec.exception.EmbeddingUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(DatasetFormatException.class)
    public ResponseEntity<Map<String, Object>> datasetFormat(DatasetFormatException ex) {
        return body(HttpStatus.BAD_REQUEST, "dataset_format", ex.getMessage());
    }

    @ExceptionHandler(CatalogIndexNotBuiltException.class)
    public ResponseEntity<Map<String, Object>> notBuilt(CatalogIndexNotBuiltException ex) {
        return body(HttpStatus.CONFLICT, "index_not_built", ex.getMessage());
    }

    @ExceptionHandler(EmbeddingUnavailableException.class)
    public ResponseEntity<Map<String, Object>> embeddingUnavailable(EmbeddingUnavailableException ex) {
        log.error("Embedding model unavailable", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "embedding_unavailable", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> internal(Exception ex) {
        log.error("Unhandled request failure", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "error", error,
                "message", message == null ? "unexpected error" : message
        ));
    }
}
