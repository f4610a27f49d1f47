package com.example.AssessRec.repository;

import com.example.AssessRec.embedding.EmbeddingProvider;
import com.example.AssessRec.exception.CatalogIndexNotBuiltException;
import com.example.AssessRec.exception.EmbeddingDimensionMismatchException;
import com.example.AssessRec.model.AssessmentRecord;
import com.example.AssessRec.model.IndexedNeighbor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact cosine search over an immutable snapshot.
 * A build creates a new snapshot and publishes it in one volatile write, so readers
 * never observe a half-built index.
 */
public class InMemoryVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    private static final Comparator<IndexedNeighbor> NEAREST_FIRST =
            Comparator.comparingDouble(IndexedNeighbor::distance)
                    .thenComparingLong(IndexedNeighbor::ordinal);

    private final EmbeddingProvider embeddingProvider;

    private volatile Snapshot snapshot;

    public InMemoryVectorIndex(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public synchronized void build(List<AssessmentRecord> records, boolean reset) {
        Snapshot previous = reset ? null : snapshot;
        List<Entry> entries = previous == null ? new ArrayList<>() : new ArrayList<>(previous.entries());
        int dimension = previous == null ? -1 : previous.dimension();

        List<String> texts = records.stream().map(AssessmentRecord::fullText).toList();
        List<float[]> vectors = embeddingProvider.encodeAll(texts);

        long ordinal = entries.size();
        for (int i = 0; i < records.size(); i++) {
            float[] vector = vectors.get(i);
            if (dimension < 0) {
                dimension = vector.length;
            } else if (vector.length != dimension) {
                throw new EmbeddingDimensionMismatchException(dimension, vector.length);
            }
            entries.add(new Entry(records.get(i), vector.clone(), norm(vector), ordinal++));
        }

        snapshot = new Snapshot(List.copyOf(entries), dimension);
        log.info("In-memory catalog index built: {} new records, {} total (reset={})",
                records.size(), entries.size(), reset);
    }

    @Override
    public List<IndexedNeighbor> query(float[] vector, int k) {
        Snapshot current = requireBuilt();
        if (current.entries().isEmpty() || k <= 0) {
            return List.of();
        }
        if (vector.length != current.dimension()) {
            throw new EmbeddingDimensionMismatchException(current.dimension(), vector.length);
        }

        double queryNorm = norm(vector);
        return current.entries().stream()
                .map(entry -> new IndexedNeighbor(entry.record(),
                        cosineDistance(vector, queryNorm, entry.vector(), entry.norm()),
                        entry.ordinal()))
                .sorted(NEAREST_FIRST)
                .limit(k)
                .toList();
    }

    @Override
    public int count() {
        return requireBuilt().entries().size();
    }

    @Override
    public boolean isBuilt() {
        return snapshot != null;
    }

    @Override
    public String storeName() {
        return "memory";
    }

    private Snapshot requireBuilt() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new CatalogIndexNotBuiltException(storeName());
        }
        return current;
    }

    /**
     * 1 - cosine similarity. A zero vector has no direction and sits at distance 1.
     */
    static double cosineDistance(float[] a, double normA, float[] b, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return 1.0;
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return 1.0 - dot / (normA * normB);
    }

    private static double norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return Math.sqrt(sum);
    }

    private record Entry(AssessmentRecord record, float[] vector, double norm, long ordinal) { }

    private record Snapshot(List<Entry> entries, int dimension) { }
}
