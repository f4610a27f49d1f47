package com.example.AssessRec.embedding;

import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.exception.EmbeddingUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link EmbeddingProvider} backed by the Spring AI {@link EmbeddingModel} bean.
 * Model failures are surfaced as {@link EmbeddingUnavailableException}; there is no fallback model.
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;
    private final int batchSize;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, RecommenderProperties properties) {
        this.embeddingModel = embeddingModel;
        this.batchSize = Math.max(1, properties.getEmbedding().getBatchSize());
    }

    @Override
    public float[] encode(String text) {
        float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding model call failed", e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
        }
        return vector;
    }

    @Override
    public List<float[]> encodeAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.info("Generating embeddings for {} texts (batch size {})", texts.size(), batchSize);

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            List<float[]> embedded;
            try {
                embedded = embeddingModel.embed(batch);
            } catch (RuntimeException e) {
                throw new EmbeddingUnavailableException(
                        "Embedding model call failed for batch starting at " + start, e);
            }
            if (embedded == null || embedded.size() != batch.size()) {
                throw new EmbeddingUnavailableException("Embedding model returned "
                        + (embedded == null ? 0 : embedded.size()) + " vectors for " + batch.size() + " texts");
            }
            vectors.addAll(embedded);
        }
        return vectors;
    }
}
