package com.example.AssessRec.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Mean Recall@K over ranked predictions.
 * <p>
 * For each query: Recall@K = |set(top K predictions) ∩ ground truth| / |ground truth|.
 * Mean Recall@K is the average across all queries that have a prediction entry.
 * <p>
 * Per-query work is pure; aggregation sorts the values first, so the summary does not
 * depend on the order in which queries were evaluated.
 */
public class MeanRecallAtKEvaluator {

    private static final Logger log = LoggerFactory.getLogger(MeanRecallAtKEvaluator.class);

    public static final List<Integer> DEFAULT_K_VALUES = List.of(5, 10);

    private final List<Integer> kValues;

    public MeanRecallAtKEvaluator() {
        this(DEFAULT_K_VALUES);
    }

    public MeanRecallAtKEvaluator(List<Integer> kValues) {
        if (kValues == null || kValues.isEmpty()) {
            throw new IllegalArgumentException("at least one K value is required");
        }
        for (Integer k : kValues) {
            if (k == null || k < 1) {
                throw new IllegalArgumentException("K values must be positive, got " + k);
            }
        }
        this.kValues = List.copyOf(new LinkedHashSet<>(kValues));
    }

    public List<Integer> kValues() {
        return kValues;
    }

    /**
     * Recall@K for a single query.
     * An empty ground truth scores 1.0: there is nothing to miss.
     * Duplicate predictions inside the top K count once.
     *
     * @param predicted   ranked identifiers, best first
     * @param groundTruth relevant identifiers
     * @param k           cut-off, not negative
     */
    public double calculateRecallAtK(List<String> predicted, Collection<String> groundTruth, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative, got " + k);
        }
        if (groundTruth == null || groundTruth.isEmpty()) {
            return 1.0;
        }
        Set<String> relevant = new HashSet<>(groundTruth);
        if (predicted == null || predicted.isEmpty()) {
            return 0.0;
        }

        Set<String> topK = new HashSet<>(predicted.subList(0, Math.min(k, predicted.size())));
        topK.retainAll(relevant);
        return (double) topK.size() / relevant.size();
    }

    public MeanRecallReport evaluateSystem(Map<String, List<String>> predictionsByQuery, GroundTruthSet groundTruth) {
        return evaluateSystem(predictionsByQuery, groundTruth.asMap());
    }

    /**
     * Evaluate every ground-truth query against its prediction list.
     * Queries without a prediction entry are logged and left out of the count and of
     * every aggregate.
     */
    public MeanRecallReport evaluateSystem(Map<String, List<String>> predictionsByQuery,
                                           Map<String, ? extends Collection<String>> groundTruthByQuery) {
        Map<String, Map<Integer, Double>> perQuery = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();

        groundTruthByQuery.forEach((queryId, relevant) -> {
            if (!predictionsByQuery.containsKey(queryId)) {
                log.warn("No predictions found for query: {}", queryId);
                skipped.add(queryId);
                return;
            }
            List<String> predicted = predictionsByQuery.get(queryId);
            Map<Integer, Double> recalls = new LinkedHashMap<>();
            for (int k : kValues) {
                recalls.put(k, calculateRecallAtK(predicted, relevant, k));
            }
            perQuery.put(queryId, recalls);
        });

        Map<Integer, RecallSummary> summary = new LinkedHashMap<>();
        if (!perQuery.isEmpty()) {
            for (int k : kValues) {
                double[] values = perQuery.values().stream().mapToDouble(r -> r.get(k)).toArray();
                RecallSummary s = summarize(values);
                summary.put(k, s);
                log.info("recall@{}: {} ± {}", k,
                        String.format(Locale.US, "%.4f", s.mean()), String.format(Locale.US, "%.4f", s.std()));
            }
        }

        return new MeanRecallReport(perQuery.size(), kValues, unmodifiableNested(perQuery), summary, skipped);
    }

    static RecallSummary summarize(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double min = sorted[0];
        double max = sorted[sorted.length - 1];
        if (min == max) {
            return new RecallSummary(min, 0.0, min, max);
        }

        double sum = 0.0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / sorted.length;

        double squared = 0.0;
        for (double v : sorted) {
            double d = v - mean;
            squared += d * d;
        }
        double std = Math.sqrt(squared / sorted.length);

        return new RecallSummary(mean, std, min, max);
    }

    private static Map<String, Map<Integer, Double>> unmodifiableNested(Map<String, Map<Integer, Double>> perQuery) {
        Map<String, Map<Integer, Double>> copy = new LinkedHashMap<>();
        perQuery.forEach((q, r) -> copy.put(q, Collections.unmodifiableMap(r)));
        return Collections.unmodifiableMap(copy);
    }
}
