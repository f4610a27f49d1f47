package com.example.AssessRec.model;

import java.util.List;

/**
 * Request payload for recommendations.
 * Either {@code query} (free text) or {@code jobTitle} (structured) must be set.
 *
 * @param jobTitle          structured: job title
 * @param skills            structured: required skills
 * @param experienceLevel   structured: experience level, defaults to Mid
 * @param additionalContext structured: optional context
 * @param query             free-form query text
 * @param topK              optional override for retrieval topK
 * @param explain           optional switch for the generated explanation, defaults to true
 */
public record RecommendRequest(
        String jobTitle,
        List<String> skills,
        String experienceLevel,
        String additionalContext,
        String query,
        Integer topK,
        Boolean explain
) {
    public int resolveTopK(int defaultValue) {
        return topK == null || topK <= 0 ? defaultValue : topK;
    }

    public boolean resolveExplain() {
        return explain == null || explain;
    }

    public boolean isStructured() {
        return jobTitle != null && !jobTitle.isBlank();
    }

    public AssessmentQuery toQuery() {
        return new AssessmentQuery(jobTitle, skills, experienceLevel, additionalContext);
    }
}
