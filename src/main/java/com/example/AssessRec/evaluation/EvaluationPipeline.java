package com.example.AssessRec.evaluation;

import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.model.RetrievalResult;
import com.example.AssessRec.service.AssessmentRetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Labeled queries in, Mean Recall@K report and prediction files out.
 * <p>
 * Each query's retrieval is independent, so predictions are produced concurrently with
 * bounded parallelism. The resulting map keeps the input query order regardless of
 * completion order.
 */
@Service
public class EvaluationPipeline {

    private static final Logger log = LoggerFactory.getLogger(EvaluationPipeline.class);

    static final String TRAINING_PREDICTIONS_FILE = "training_predictions.csv";
    static final String TEST_PREDICTIONS_FILE = "test_predictions.csv";
    static final String REPORT_FILE = "evaluation_report.txt";

    private final AssessmentRetrievalService retrievalService;
    private final MeanRecallAtKEvaluator evaluator;
    private final GroundTruthLoader groundTruthLoader;
    private final PredictionCsvWriter predictionCsvWriter;
    private final EvaluationReportWriter reportWriter;
    private final int predictionDepth;
    private final int parallelism;

    public EvaluationPipeline(AssessmentRetrievalService retrievalService,
                              MeanRecallAtKEvaluator evaluator,
                              GroundTruthLoader groundTruthLoader,
                              PredictionCsvWriter predictionCsvWriter,
                              EvaluationReportWriter reportWriter,
                              RecommenderProperties properties) {
        this.retrievalService = retrievalService;
        this.evaluator = evaluator;
        this.groundTruthLoader = groundTruthLoader;
        this.predictionCsvWriter = predictionCsvWriter;
        this.reportWriter = reportWriter;
        this.predictionDepth = Math.max(1, properties.getEvaluation().getPredictionDepth());
        this.parallelism = Math.max(1, properties.getEvaluation().getParallelism());
    }

    /**
     * Ranked urls per query, retrieval only (no explanation calls).
     * A query whose retrieval fails is logged and left out of the result, so the
     * evaluator reports it as skipped.
     */
    public Map<String, List<String>> generatePredictions(Collection<String> queries, int depth) {
        List<String> ordered = List.copyOf(new LinkedHashSet<>(queries));
        log.info("Generating predictions for {} queries (depth={}, parallelism={})",
                ordered.size(), depth, parallelism);

        Map<String, List<String>> completed = Flux.fromIterable(ordered)
                .flatMap(query -> Mono.fromCallable(() -> Map.entry(query, predictUrls(query, depth)))
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.warn("Prediction failed for query '{}': {}", query, e.toString());
                            return Mono.empty();
                        }), parallelism)
                .collectMap(Map.Entry::getKey, Map.Entry::getValue)
                .block();

        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String query : ordered) {
            if (completed != null && completed.containsKey(query)) {
                result.put(query, completed.get(query));
            }
        }
        return result;
    }

    public MeanRecallReport evaluate(GroundTruthSet groundTruth) {
        Map<String, List<String>> predictions = generatePredictions(groundTruth.queryIds(), predictionDepth);
        return evaluator.evaluateSystem(predictions, groundTruth);
    }

    /**
     * 1. load labeled queries, 2. predict, 3. compute Mean Recall@K,
     * 4. write training predictions, 5. predict and write unlabeled test queries (optional),
     * 6. write the text report.
     */
    public EvaluationRun runFullEvaluation(Path trainingDataFile, Path testDataFile, Path outputDir) {
        log.info("Starting full evaluation pipeline...");
        GroundTruthSet groundTruth = groundTruthLoader.load(trainingDataFile);

        Map<String, List<String>> trainingPredictions =
                generatePredictions(groundTruth.queryIds(), predictionDepth);
        MeanRecallReport report = evaluator.evaluateSystem(trainingPredictions, groundTruth);

        Path trainingFile = predictionCsvWriter.write(outputDir.resolve(TRAINING_PREDICTIONS_FILE), trainingPredictions);

        Path testFile = null;
        if (testDataFile != null) {
            List<String> testQueries = groundTruthLoader.loadQueries(testDataFile);
            testFile = predictionCsvWriter.write(outputDir.resolve(TEST_PREDICTIONS_FILE),
                    generatePredictions(testQueries, predictionDepth));
        }

        Path reportFile = reportWriter.write(outputDir.resolve(REPORT_FILE), report);
        log.info("Evaluation complete. Results saved to {}", outputDir);
        return new EvaluationRun(report, trainingFile, testFile, reportFile);
    }

    private List<String> predictUrls(String query, int depth) {
        List<RetrievalResult> results = retrievalService.retrieve(query, depth);
        return results.stream()
                .map(r -> r.assessment().url())
                .filter(url -> url != null && !url.isBlank())
                .toList();
    }
}
