package com.example.AssessRec.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One catalog row as it arrives from the processed catalog file.
 * Column names follow the snake_case layout of the processed CSV.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogEntry {
    private String name;
    private String category;
    private String description;

    @JsonProperty("skills_measured")
    @JsonAlias("skillsMeasured")
    private String skillsMeasured;

    @JsonProperty("job_suitability")
    @JsonAlias("jobSuitability")
    private String jobSuitability;

    @JsonProperty("experience_level")
    @JsonAlias("experienceLevel")
    private String experienceLevel;

    private String duration;

    @JsonProperty("delivery_method")
    @JsonAlias("deliveryMethod")
    private String deliveryMethod;

    @JsonAlias("assessment_url")
    private String url;
}
