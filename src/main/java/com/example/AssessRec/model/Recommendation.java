package com.example.AssessRec.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Retrieval output plus an optional generated explanation.
 * The explanation is absent when generation was disabled, timed out or failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Recommendation(
        String query,
        List<RetrievalResult> retrievedAssessments,
        String explanation,
        int retrievalCount,
        Instant generatedAt
) {
    public boolean hasExplanation() {
        return explanation != null && !explanation.isBlank();
    }
}
