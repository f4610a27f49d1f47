package com.example.AssessRec.model;

/**
 * A single stage event of a streamed recommendation.
 *
 * stage   - "start", "retrieval", "explanation", "explanation_unavailable" or "done"
 * message - human-readable description of the step
 * payload - stage specific data (retrieval summaries, explanation text, final result)
 */
public record RecommendationEvent(
        String stage,
        String message,
        Object payload
) {
}
