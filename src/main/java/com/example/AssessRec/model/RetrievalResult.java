package com.example.AssessRec.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;

/**
 * One ranked retrieval hit.
 *
 * @param rank            1-based position in the result list
 * @param assessment      matched catalog record
 * @param similarityScore 1 - cosine distance, never filtered
 */
public record RetrievalResult(
        int rank,
        @JsonUnwrapped AssessmentRecord assessment,
        double similarityScore
) {
}
