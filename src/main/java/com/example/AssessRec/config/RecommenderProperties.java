package com.example.AssessRec.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the retrieval, recommendation and evaluation components.
 * Passed into each component's constructor; tests build it directly.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recommender")
public class RecommenderProperties {

    private Retrieval retrieval = new Retrieval();
    private Embedding embedding = new Embedding();
    private Explanation explanation = new Explanation();
    private Evaluation evaluation = new Evaluation();
    private Catalog catalog = new Catalog();
    private Index index = new Index();

    @Getter
    @Setter
    public static class Retrieval {
        /** Default K when a caller does not pass one. */
        private int topK = 10;
    }

    @Getter
    @Setter
    public static class Embedding {
        private int batchSize = 32;
    }

    @Getter
    @Setter
    public static class Explanation {
        private boolean enabled = true;
        /** "openai" or "deepseek". */
        private String provider = "openai";
        private Duration timeout = Duration.ofSeconds(20);
        private String systemPrompt = "You are an expert HR technology consultant specializing in "
                + "pre-employment assessment products. Recommend only assessments that appear in the "
                + "catalog excerpt you are given.";
    }

    @Getter
    @Setter
    public static class Evaluation {
        private List<Integer> kValues = new ArrayList<>(List.of(5, 10));
        /** Number of predictions generated per query before Recall@K is computed. */
        private int predictionDepth = 10;
        private int parallelism = 4;
    }

    @Getter
    @Setter
    public static class Catalog {
        private String path = "data/processed/assessments.csv";
        private boolean buildOnStartup = false;
    }

    @Getter
    @Setter
    public static class Index {
        /** "memory" or "pgvector". */
        private String store = "memory";
        private String tableName = "assessment_catalog";
    }
}
