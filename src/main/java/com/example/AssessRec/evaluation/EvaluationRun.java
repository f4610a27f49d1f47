package com.example.AssessRec.evaluation;

import java.nio.file.Path;

/**
 * Output of a full evaluation run.
 *
 * @param report               Mean Recall@K report for the labeled queries
 * @param trainingPredictions  predictions CSV for the labeled queries
 * @param testPredictions      predictions CSV for the unlabeled queries, null when none were given
 * @param reportFile           text report
 */
public record EvaluationRun(
        MeanRecallReport report,
        Path trainingPredictions,
        Path testPredictions,
        Path reportFile
) {
}
