package com.example.AssessRec.service;

import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.embedding.EmbeddingProvider;
import com.example.AssessRec.model.AssessmentQuery;
import com.example.AssessRec.model.AssessmentRecord;
import com.example.AssessRec.model.IndexedNeighbor;
import com.example.AssessRec.model.RetrievalResult;
import com.example.AssessRec.repository.VectorIndex;
import com.example.AssessRec.util.QueryTextBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Retrieval-only service:
 * - Canonicalizes structured input (free text passes through)
 * - Embeds the query text
 * - Queries the catalog index for the k nearest records
 * - Converts distance to similarity (1 - distance) and assigns ranks
 *
 * No similarity threshold is applied: every neighbor the index returns is kept,
 * however weak, so recall is never traded away silently.
 * This service does NOT call any chat/LLM APIs.
 */
@Service
public class AssessmentRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentRetrievalService.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorIndex vectorIndex;
    private final int defaultTopK;

    public AssessmentRetrievalService(EmbeddingProvider embeddingProvider,
                                      VectorIndex vectorIndex,
                                      RecommenderProperties properties) {
        this.embeddingProvider = embeddingProvider;
        this.vectorIndex = vectorIndex;
        this.defaultTopK = properties.getRetrieval().getTopK();
    }

    public int defaultTopK() {
        return defaultTopK;
    }

    public List<RetrievalResult> retrieve(AssessmentQuery query, int topK) {
        String queryText = QueryTextBuilder.build(query);
        log.info("Structured query: {}", queryText);
        return search(queryText, topK);
    }

    public List<RetrievalResult> retrieve(String queryText, int topK) {
        if (queryText == null || queryText.isBlank()) {
            throw new IllegalArgumentException("query text must not be blank");
        }
        log.info("Free-form query: {}", queryText);
        return search(queryText, topK);
    }

    private List<RetrievalResult> search(String queryText, int topK) {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be at least 1, got " + topK);
        }
        float[] queryEmbedding = embeddingProvider.encode(queryText);
        List<IndexedNeighbor> neighbors = vectorIndex.query(queryEmbedding, topK);

        List<RetrievalResult> results = new ArrayList<>(neighbors.size());
        for (IndexedNeighbor neighbor : neighbors) {
            double similarity = 1.0 - neighbor.distance();
            RetrievalResult result = new RetrievalResult(results.size() + 1, neighbor.record(), similarity);
            results.add(result);
            log.debug("Result {}: {} - similarity {}", result.rank(), neighbor.record().name(),
                    String.format(Locale.US, "%.4f", similarity));
        }

        log.info("Retrieved {} assessments (topK={})", results.size(), topK);
        return List.copyOf(results);
    }

    /**
     * Render retrieved records as the catalog excerpt handed to the explanation model.
     */
    public String buildContext(List<RetrievalResult> results) {
        if (results == null || results.isEmpty()) {
            return "(no results)";
        }
        return results.stream()
                .map(r -> {
                    AssessmentRecord a = r.assessment();
                    return "Assessment: " + a.name()
                            + "\nCategory: " + a.category()
                            + "\nDescription: " + a.description()
                            + "\nSkills Measured: " + a.skillsMeasured()
                            + "\nJob Suitability: " + a.jobSuitability()
                            + "\nExperience Levels: " + a.experienceLevel()
                            + "\nDuration: " + a.duration()
                            + "\nRelevance Score: " + String.format(Locale.US, "%.2f", r.similarityScore());
                })
                .collect(Collectors.joining("\n---\n"));
    }
}
