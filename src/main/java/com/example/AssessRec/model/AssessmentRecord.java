package com.example.AssessRec.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Immutable catalog item as stored in the vector index.
 *
 * @param id              stable identifier derived from url (or name when url is blank)
 * @param name            assessment name
 * @param category        catalog category
 * @param description     free-text description
 * @param skillsMeasured  comma separated skills
 * @param jobSuitability  comma separated job families
 * @param experienceLevel comma separated experience levels
 * @param duration        duration as published
 * @param deliveryMethod  delivery method as published
 * @param url             catalog url, the identifier space used by ground truth
 * @param fullText        embedding text, see {@link #composeFullText}
 */
public record AssessmentRecord(
        String id,
        String name,
        String category,
        String description,
        String skillsMeasured,
        String jobSuitability,
        String experienceLevel,
        String duration,
        String deliveryMethod,
        String url,
        @JsonIgnore String fullText
) {

    public static AssessmentRecord fromEntry(CatalogEntry entry) {
        String name = nullToEmpty(entry.getName());
        String url = nullToEmpty(entry.getUrl());
        String category = nullToEmpty(entry.getCategory());
        String description = nullToEmpty(entry.getDescription());
        String skills = nullToEmpty(entry.getSkillsMeasured());
        String suitability = nullToEmpty(entry.getJobSuitability());
        String experience = nullToEmpty(entry.getExperienceLevel());

        return new AssessmentRecord(
                deriveId(url, name),
                name,
                category,
                description,
                skills,
                suitability,
                experience,
                nullToEmpty(entry.getDuration()),
                nullToEmpty(entry.getDeliveryMethod()),
                url,
                composeFullText(name, category, description, skills, suitability, experience)
        );
    }

    /**
     * Fixed template used for embedding. Changing it changes every stored vector.
     */
    public static String composeFullText(String name,
                                         String category,
                                         String description,
                                         String skillsMeasured,
                                         String jobSuitability,
                                         String experienceLevel) {
        return "Assessment: " + name
                + " | Category: " + category
                + " | Description: " + description
                + " | Skills Measured: " + skillsMeasured
                + " | Suitable for: " + jobSuitability
                + " | Experience Levels: " + experienceLevel;
    }

    private static String deriveId(String url, String name) {
        String key = url.isBlank() ? "name:" + name : url;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
