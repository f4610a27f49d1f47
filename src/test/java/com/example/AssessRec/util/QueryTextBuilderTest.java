package com.example.AssessRec.util;

import com.example.AssessRec.model.AssessmentQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QueryTextBuilderTest {

    @Test
    @DisplayName("Structured query renders title, skills and level in a fixed layout")
    void buildsCanonicalText() {
        AssessmentQuery query = new AssessmentQuery("Software Engineer", List.of("Java", "Python"), "Mid", null);

        assertThat(QueryTextBuilder.build(query))
                .isEqualTo("Job Title: Software Engineer | Required Skills: Java, Python | Experience Level: Mid");
    }

    @Test
    @DisplayName("Additional context is appended only when present")
    void appendsContextWhenPresent() {
        AssessmentQuery withContext = new AssessmentQuery("Analyst", List.of("SQL"), "Senior", "Remote team");
        AssessmentQuery blankContext = new AssessmentQuery("Analyst", List.of("SQL"), "Senior", "   ");

        assertThat(QueryTextBuilder.build(withContext)).endsWith(" | Context: Remote team");
        assertThat(QueryTextBuilder.build(blankContext)).doesNotContain("Context:");
    }

    @Test
    @DisplayName("Missing experience level defaults to Mid")
    void defaultsExperienceLevel() {
        AssessmentQuery query = new AssessmentQuery("Tester", List.of(), null, null);

        assertThat(QueryTextBuilder.build(query))
                .isEqualTo("Job Title: Tester | Required Skills:  | Experience Level: Mid");
    }

    @Test
    @DisplayName("Same input always yields the same text")
    void isDeterministic() {
        AssessmentQuery a = new AssessmentQuery("Engineer", List.of("Go", "Rust"), "Entry", "ctx");
        AssessmentQuery b = new AssessmentQuery("Engineer", List.of("Go", "Rust"), "Entry", "ctx");

        assertThat(QueryTextBuilder.build(a)).isEqualTo(QueryTextBuilder.build(b));
    }
}
