package com.example.AssessRec.evaluation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MeanRecallAtKEvaluatorTest {

    private final MeanRecallAtKEvaluator evaluator = new MeanRecallAtKEvaluator();

    @Nested
    @DisplayName("Recall@K for one query")
    class SingleQuery {

        @Test
        @DisplayName("Empty ground truth scores 1.0")
        void emptyGroundTruth() {
            assertThat(evaluator.calculateRecallAtK(List.of("a"), Set.of(), 5)).isEqualTo(1.0);
            assertThat(evaluator.calculateRecallAtK(List.of(), List.of(), 5)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Only the first K predictions count")
        void cutsAtK() {
            assertThat(evaluator.calculateRecallAtK(List.of("a", "b", "c"), List.of("a", "c", "z"), 2))
                    .isCloseTo(1.0 / 3.0, within(1e-12));
        }

        @Test
        @DisplayName("K beyond the prediction list uses every prediction")
        void kBeyondList() {
            assertThat(evaluator.calculateRecallAtK(List.of("a", "b"), List.of("a", "b"), 5)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Duplicate predictions count once")
        void duplicatesCountOnce() {
            assertThat(evaluator.calculateRecallAtK(List.of("a", "a", "b"), List.of("a", "b"), 2)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("No predictions against a non-empty ground truth scores 0")
        void noPredictions() {
            assertThat(evaluator.calculateRecallAtK(List.of(), List.of("a"), 5)).isZero();
            assertThat(evaluator.calculateRecallAtK(null, List.of("a"), 5)).isZero();
        }

        @Test
        @DisplayName("K = 0 scores 0 and negative K is rejected")
        void kBounds() {
            assertThat(evaluator.calculateRecallAtK(List.of("a"), List.of("a"), 0)).isZero();
            assertThatThrownBy(() -> evaluator.calculateRecallAtK(List.of("a"), List.of("a"), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("System evaluation")
    class SystemEvaluation {

        @Test
        @DisplayName("Mean, std, min and max are computed per K")
        void aggregates() {
            Map<String, List<String>> predictions = Map.of(
                    "q1", List.of("a", "b"),
                    "q2", List.of("x", "y"));
            Map<String, List<String>> groundTruth = new LinkedHashMap<>();
            groundTruth.put("q1", List.of("a", "b"));
            groundTruth.put("q2", List.of("a", "b"));

            MeanRecallReport report = evaluator.evaluateSystem(predictions, groundTruth);

            RecallSummary at5 = report.summary().get(5);
            assertThat(report.queriesEvaluated()).isEqualTo(2);
            assertThat(at5.mean()).isEqualTo(0.5);
            assertThat(at5.std()).isEqualTo(0.5);
            assertThat(at5.min()).isZero();
            assertThat(at5.max()).isEqualTo(1.0);
            assertThat(report.meanRecallAt(10)).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Queries without predictions are skipped, not scored as zero")
        void missingQueriesExcluded() {
            Map<String, List<String>> predictions = Map.of("q1", List.of("a"));
            Map<String, List<String>> groundTruth = new LinkedHashMap<>();
            groundTruth.put("q1", List.of("a"));
            groundTruth.put("q2", List.of("b"));

            MeanRecallReport report = evaluator.evaluateSystem(predictions, groundTruth);

            assertThat(report.queriesEvaluated()).isEqualTo(1);
            assertThat(report.meanRecallAt(5)).isEqualTo(1.0);
            assertThat(report.skippedQueries()).containsExactly("q2");
            assertThat(report.perQueryRecall()).containsOnlyKeys("q1");
        }

        @Test
        @DisplayName("Identical recalls give a standard deviation of exactly 0")
        void zeroStd() {
            Map<String, List<String>> predictions = Map.of(
                    "q1", List.of("a", "x", "y"),
                    "q2", List.of("b", "x", "y"),
                    "q3", List.of("c", "x", "y"));
            Map<String, List<String>> groundTruth = Map.of(
                    "q1", List.of("a", "z", "w"),
                    "q2", List.of("b", "z", "w"),
                    "q3", List.of("c", "z", "w"));

            MeanRecallReport report = evaluator.evaluateSystem(predictions, groundTruth);

            assertThat(report.summary().get(5).std()).isEqualTo(0.0);
            assertThat(report.summary().get(5).mean()).isEqualTo(1.0 / 3.0);
        }

        @Test
        @DisplayName("Summary does not depend on query order")
        void orderIndependent() {
            Map<String, List<String>> predictions = Map.of(
                    "q1", List.of("a"), "q2", List.of("b", "c"), "q3", List.of("x"));
            Map<String, List<String>> forward = new LinkedHashMap<>();
            forward.put("q1", List.of("a", "b", "c"));
            forward.put("q2", List.of("c"));
            forward.put("q3", List.of("y", "z"));
            Map<String, List<String>> backward = new LinkedHashMap<>();
            backward.put("q3", forward.get("q3"));
            backward.put("q2", forward.get("q2"));
            backward.put("q1", forward.get("q1"));

            assertThat(evaluator.evaluateSystem(predictions, backward).summary())
                    .isEqualTo(evaluator.evaluateSystem(predictions, forward).summary());
        }

        @Test
        @DisplayName("Nothing to evaluate yields an empty summary")
        void nothingEvaluated() {
            MeanRecallReport report = evaluator.evaluateSystem(Map.of(), Map.of("q1", List.of("a")));

            assertThat(report.queriesEvaluated()).isZero();
            assertThat(report.summary()).isEmpty();
        }

        @Test
        @DisplayName("Ground truth sets are accepted directly")
        void acceptsGroundTruthSet() {
            GroundTruthSet groundTruth = GroundTruthSet.of(Map.of("q1", List.of(" a ", "", "a")));

            MeanRecallReport report = evaluator.evaluateSystem(Map.of("q1", List.of("a")), groundTruth);

            assertThat(report.meanRecallAt(5)).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("K values must be positive")
    void validatesKValues() {
        assertThatThrownBy(() -> new MeanRecallAtKEvaluator(List.of(0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeanRecallAtKEvaluator(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThat(new MeanRecallAtKEvaluator(List.of(3, 3, 1)).kValues()).containsExactly(3, 1);
    }
}
