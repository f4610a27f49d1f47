package com.example.AssessRec.repository;

import com.example.AssessRec.model.AssessmentRecord;
import com.example.AssessRec.model.IndexedNeighbor;

import java.util.List;

/**
 * Holds {id, vector, metadata, text} for every catalog record and answers
 * nearest-neighbor queries.
 * <p>
 * Single writer, many readers: {@link #build} must complete before queries are served.
 * Once built the index is read-only, so concurrent {@link #query} calls need no locking.
 */
public interface VectorIndex {

    /**
     * Embeds every record's full text in one batch and stores vector and metadata.
     *
     * @param reset clear previous contents first
     */
    void build(List<AssessmentRecord> records, boolean reset);

    /**
     * Up to {@code k} neighbors ordered by ascending cosine distance, ties broken by
     * ingestion order. Never padded: fewer than {@code k} entries are returned when the
     * index holds fewer.
     *
     * @throws com.example.AssessRec.exception.CatalogIndexNotBuiltException if never built
     */
    List<IndexedNeighbor> query(float[] vector, int k);

    int count();

    boolean isBuilt();

    /** Short store name for status reporting. */
    String storeName();
}
