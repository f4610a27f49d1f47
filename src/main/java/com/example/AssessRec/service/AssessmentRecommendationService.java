package com.example.AssessRec.service;

import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.model.AssessmentQuery;
import com.example.AssessRec.model.Recommendation;
import com.example.AssessRec.model.RecommendationEvent;
import com.example.AssessRec.model.RetrievalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Retrieval plus an optional generated explanation.
 * <p>
 * The explanation model only sees the retrieved records and is told to recommend from
 * that set alone. This is an instruction, not a check: the generated text is returned
 * as-is. Generation runs with its own timeout; any failure leaves the retrieval output
 * untouched and the explanation absent.
 */
@Service
public class AssessmentRecommendationService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentRecommendationService.class);

    private final AssessmentRetrievalService retrievalService;
    private final ExplanationGenerator explanationGenerator;
    private final RecommenderProperties.Explanation explanationSettings;

    public AssessmentRecommendationService(AssessmentRetrievalService retrievalService,
                                           ExplanationGenerator explanationGenerator,
                                           RecommenderProperties properties) {
        this.retrievalService = retrievalService;
        this.explanationGenerator = explanationGenerator;
        this.explanationSettings = properties.getExplanation();
    }

    public Recommendation recommend(String jobTitle,
                                    List<String> skills,
                                    String experienceLevel,
                                    String additionalContext) {
        return recommend(new AssessmentQuery(jobTitle, skills, experienceLevel, additionalContext),
                retrievalService.defaultTopK(), true);
    }

    public Recommendation recommend(String queryText) {
        return recommend(queryText, retrievalService.defaultTopK(), true);
    }

    public Recommendation recommend(AssessmentQuery query, int topK, boolean explain) {
        log.info("Generating recommendations for: {}", query.jobTitle());
        List<RetrievalResult> results = retrievalService.retrieve(query, topK);
        String explanation = explain ? explain(buildStructuredPrompt(query, results), results).orElse(null) : null;
        return new Recommendation(query.jobTitle(), results, explanation, results.size(), Instant.now());
    }

    public Recommendation recommend(String queryText, int topK, boolean explain) {
        log.info("Generating recommendations for query: {}", queryText);
        List<RetrievalResult> results = retrievalService.retrieve(queryText, topK);
        String explanation = explain ? explain(buildFreeTextPrompt(queryText, results), results).orElse(null) : null;
        return new Recommendation(queryText, results, explanation, results.size(), Instant.now());
    }

    /**
     * Streaming recommendation with stage events:
     *  - "start": request accepted
     *  - "retrieval": ranked results are ready
     *  - "explanation" or "explanation_unavailable"
     *  - "done": the complete {@link Recommendation}
     * Retrieval is emitted before generation starts, so a slow model never holds it back.
     */
    public Flux<RecommendationEvent> streamRecommendation(String queryText, int topK) {
        Mono<List<RetrievalResult>> retrievalMono =
                Mono.fromCallable(() -> retrievalService.retrieve(queryText, topK))
                        .subscribeOn(Schedulers.boundedElastic())
                        .cache();

        Mono<Optional<String>> explanationMono = retrievalMono
                .flatMap(results -> generationMono(buildFreeTextPrompt(queryText, results), results))
                .cache();

        Flux<RecommendationEvent> startStep = Flux.just(new RecommendationEvent(
                "start", "Request received. Searching the assessment catalog.",
                Map.of("ts", System.currentTimeMillis())));

        Flux<RecommendationEvent> retrievalStep = retrievalMono.map(results -> new RecommendationEvent(
                "retrieval", "Retrieved " + results.size() + " candidate assessments.",
                summarizeRetrieval(results))).flux();

        Flux<RecommendationEvent> explanationStep = explanationMono.map(text -> text
                .map(t -> new RecommendationEvent("explanation", "Generated explanation.", t))
                .orElseGet(() -> new RecommendationEvent("explanation_unavailable",
                        "Explanation could not be generated; retrieval results are complete.", null)))
                .flux();

        Flux<RecommendationEvent> doneStep = Mono.zip(retrievalMono, explanationMono)
                .map(tuple -> new RecommendationEvent("done", "Finalized recommendation.",
                        new Recommendation(queryText, tuple.getT1(), tuple.getT2().orElse(null),
                                tuple.getT1().size(), Instant.now())))
                .flux();

        return Flux.concat(startStep, retrievalStep, explanationStep, doneStep);
    }

    private Optional<String> explain(String prompt, List<RetrievalResult> results) {
        return generationMono(prompt, results).blockOptional().flatMap(o -> o);
    }

    /**
     * Best-effort generation. Emits {@code Optional.empty()} when disabled, when there is
     * nothing to explain, on timeout (the call is cancelled) and on any failure.
     */
    private Mono<Optional<String>> generationMono(String prompt, List<RetrievalResult> results) {
        if (!explanationSettings.isEnabled() || results.isEmpty()) {
            return Mono.just(Optional.empty());
        }
        Duration timeout = explanationSettings.getTimeout();
        return Mono.fromCallable(() -> explanationGenerator.generate(explanationSettings.getSystemPrompt(), prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(Optional::of)
                .doOnNext(text -> log.info("Explanation generated ({} chars)", text.get().length()))
                .onErrorResume(e -> {
                    log.warn("Explanation generation failed, returning retrieval results only: {}", e.toString());
                    return Mono.just(Optional.empty());
                })
                .defaultIfEmpty(Optional.empty());
    }

    String buildStructuredPrompt(AssessmentQuery query, List<RetrievalResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("HIRING REQUIREMENTS:\n");
        sb.append("- Job Title: ").append(query.jobTitle()).append('\n');
        sb.append("- Required Skills: ").append(String.join(", ", query.skills())).append('\n');
        sb.append("- Experience Level: ").append(query.experienceLevel()).append('\n');
        if (query.hasContext()) {
            sb.append("- Additional Context: ").append(query.additionalContext().trim()).append('\n');
        }
        sb.append("\nAVAILABLE ASSESSMENTS (from catalog):\n");
        sb.append(retrievalService.buildContext(results)).append("\n\n");
        sb.append("TASK:\n");
        sb.append("Based ONLY on the assessments provided above, recommend the top 3-5 most suitable ")
                .append("assessments for this role. For each recommendation:\n");
        sb.append("1. State the assessment name\n");
        sb.append("2. Explain why it's relevant for this specific role\n");
        sb.append("3. Highlight which skills/competencies it addresses from the requirements\n");
        sb.append("4. Mention any important considerations (duration, experience level match, etc.)\n\n");
        sb.append("Format your response as a numbered list. Only recommend assessments from the provided catalog above.");
        return sb.toString();
    }

    String buildFreeTextPrompt(String queryText, List<RetrievalResult> results) {
        StringBuilder sb = new StringBuilder();
        sb.append("HIRING QUERY: ").append(queryText).append("\n\n");
        sb.append("AVAILABLE ASSESSMENTS (from catalog):\n");
        sb.append(retrievalService.buildContext(results)).append("\n\n");
        sb.append("TASK:\n");
        sb.append("Based ONLY on the assessments provided above, recommend the top 3-5 most suitable ")
                .append("assessments. For each recommendation:\n");
        sb.append("1. State the assessment name\n");
        sb.append("2. Explain why it's relevant\n");
        sb.append("3. Highlight key competencies it measures\n");
        sb.append("4. Mention important considerations\n\n");
        sb.append("Format as a numbered list. Only recommend assessments from the provided catalog.");
        return sb.toString();
    }

    private List<Map<String, Object>> summarizeRetrieval(List<RetrievalResult> results) {
        return results.stream()
                .map(r -> Map.<String, Object>of(
                        "rank", r.rank(),
                        "name", r.assessment().name(),
                        "url", r.assessment().url(),
                        "score", r.similarityScore()
                ))
                .toList();
    }
}
