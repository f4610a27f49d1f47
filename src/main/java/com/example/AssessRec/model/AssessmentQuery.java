package com.example.AssessRec.model;

import java.util.List;
import java.util.Objects;

/**
 * Structured hiring query. Never persisted.
 *
 * @param jobTitle          job title or role
 * @param skills            required skills, in the order the caller gave them
 * @param experienceLevel   Entry / Mid / Senior / Executive
 * @param additionalContext optional free-form hiring context
 */
public record AssessmentQuery(
        String jobTitle,
        List<String> skills,
        String experienceLevel,
        String additionalContext
) {
    public static final String DEFAULT_EXPERIENCE_LEVEL = "Mid";

    public AssessmentQuery {
        skills = skills == null
                ? List.of()
                : skills.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty()).toList();
        jobTitle = jobTitle == null ? "" : jobTitle.trim();
        experienceLevel = experienceLevel == null || experienceLevel.isBlank()
                ? DEFAULT_EXPERIENCE_LEVEL
                : experienceLevel.trim();
    }

    public boolean hasContext() {
        return additionalContext != null && !additionalContext.isBlank();
    }
}
