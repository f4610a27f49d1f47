package com.example.AssessRec.service;

/**
 * External text generation capability used to explain a recommendation.
 * Implementations throw {@link com.example.AssessRec.exception.ExplanationGenerationException}
 * on any failure.
 */
public interface ExplanationGenerator {

    String generate(String systemPrompt, String userPrompt);

    /**
     * Generator used when no chat model is configured. Every call fails, so callers
     * fall back to retrieval-only output.
     */
    static ExplanationGenerator unavailable(String reason) {
        return (systemPrompt, userPrompt) -> {
            throw new com.example.AssessRec.exception.ExplanationGenerationException(reason);
        };
    }
}
