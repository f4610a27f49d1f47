package com.example.AssessRec.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Query id -> relevant item identifiers (catalog urls). Immutable; query order is
 * the order in which queries were first seen.
 */
public final class GroundTruthSet {

    private static final Logger log = LoggerFactory.getLogger(GroundTruthSet.class);

    private final Map<String, Set<String>> relevantByQuery;

    private GroundTruthSet(Map<String, Set<String>> relevantByQuery) {
        this.relevantByQuery = relevantByQuery;
    }

    public static GroundTruthSet of(Map<String, ? extends Iterable<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((query, ids) -> {
            if (query == null || query.isBlank()) {
                log.warn("Dropping ground truth entry with a blank query id");
                return;
            }
            Set<String> cleaned = new LinkedHashSet<>();
            if (ids != null) {
                for (String id : ids) {
                    if (id != null && !id.isBlank()) {
                        cleaned.add(id.trim());
                    }
                }
            }
            copy.put(query, Collections.unmodifiableSet(cleaned));
        });
        return new GroundTruthSet(Collections.unmodifiableMap(copy));
    }

    public Set<String> queryIds() {
        return relevantByQuery.keySet();
    }

    public Set<String> relevantFor(String queryId) {
        return relevantByQuery.getOrDefault(queryId, Set.of());
    }

    public Map<String, Set<String>> asMap() {
        return relevantByQuery;
    }

    public int size() {
        return relevantByQuery.size();
    }
}
