package com.example.AssessRec.util;

import com.example.AssessRec.model.AssessmentQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonicalizes a structured query into the single text blob that gets embedded.
 * Field order is fixed: title, skills, experience level, then optional context.
 */
public final class QueryTextBuilder {

    static final String SEPARATOR = " | ";

    private QueryTextBuilder() {
    }

    public static String build(AssessmentQuery query) {
        List<String> parts = new ArrayList<>(4);
        parts.add("Job Title: " + query.jobTitle());
        parts.add("Required Skills: " + String.join(", ", query.skills()));
        parts.add("Experience Level: " + query.experienceLevel());
        if (query.hasContext()) {
            parts.add("Context: " + query.additionalContext().trim());
        }
        return String.join(SEPARATOR, parts);
    }
}
