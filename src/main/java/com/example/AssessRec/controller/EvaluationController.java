package com.example.AssessRec.controller;

import com.example.AssessRec.evaluation.EvaluationPipeline;
import com.example.AssessRec.evaluation.MeanRecallAtKEvaluator;
import com.example.AssessRec.evaluation.MeanRecallReport;
import com.example.AssessRec.evaluation.PredictionCsvWriter;
import com.example.AssessRec.service.AssessmentRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/evaluation")
@RequiredArgsConstructor
public class EvaluationController {

    private final MeanRecallAtKEvaluator evaluator;
    private final EvaluationPipeline evaluationPipeline;
    private final PredictionCsvWriter predictionCsvWriter;
    private final AssessmentRetrievalService retrievalService;

    /**
     * Score externally produced predictions:
     *   {"predictions": {"q1": ["url-a", "url-b"]}, "groundTruth": {"q1": ["url-b"]}}
     */
    @PostMapping("/recall")
    public MeanRecallReport recall(@RequestBody RecallRequest request) {
        Map<String, List<String>> predictions = request.predictions() == null ? Map.of() : request.predictions();
        Map<String, List<String>> groundTruth = request.groundTruth() == null ? Map.of() : request.groundTruth();
        return evaluator.evaluateSystem(predictions, groundTruth);
    }

    /**
     * Run retrieval for each query and return the predictions as {@code Query,Assessment_URL} CSV.
     */
    @PostMapping(value = "/predictions", produces = "text/csv")
    public String predictions(@RequestBody PredictionRequest request) {
        if (request.queries() == null || request.queries().isEmpty()) {
            throw new IllegalArgumentException("queries must not be empty");
        }
        int topK = request.topK() == null || request.topK() <= 0 ? retrievalService.defaultTopK() : request.topK();
        return predictionCsvWriter.toCsv(evaluationPipeline.generatePredictions(request.queries(), topK));
    }

    public record RecallRequest(Map<String, List<String>> predictions, Map<String, List<String>> groundTruth) { }

    public record PredictionRequest(List<String> queries, Integer topK) { }
}
