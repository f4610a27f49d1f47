package com.example.AssessRec.evaluation;

/**
 * Aggregate of per-query Recall@K values for one K.
 *
 * @param mean arithmetic mean
 * @param std  population standard deviation
 * @param min  smallest per-query recall
 * @param max  largest per-query recall
 */
public record RecallSummary(double mean, double std, double min, double max) {
}
