package com.example.AssessRec.evaluation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of one evaluation run.
 *
 * @param queriesEvaluated number of ground-truth queries that had predictions
 * @param kValues          the K values evaluated, in configured order
 * @param perQueryRecall   query -> (K -> Recall@K), in ground-truth order
 * @param summary          K -> aggregate over the evaluated queries; empty when nothing was evaluated
 * @param skippedQueries   ground-truth queries excluded because no prediction entry existed
 */
public record MeanRecallReport(
        int queriesEvaluated,
        List<Integer> kValues,
        Map<String, Map<Integer, Double>> perQueryRecall,
        Map<Integer, RecallSummary> summary,
        List<String> skippedQueries
) {
    public MeanRecallReport {
        kValues = List.copyOf(kValues);
        perQueryRecall = Collections.unmodifiableMap(new LinkedHashMap<>(perQueryRecall));
        summary = Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        skippedQueries = List.copyOf(skippedQueries);
    }

    public double meanRecallAt(int k) {
        RecallSummary s = summary.get(k);
        if (s == null) {
            throw new IllegalArgumentException("Recall@" + k + " was not evaluated");
        }
        return s.mean();
    }
}
