package com.example.AssessRec.controller;

import com.example.AssessRec.model.Recommendation;
import com.example.AssessRec.model.RecommendationEvent;
import com.example.AssessRec.model.RecommendRequest;
import com.example.AssessRec.service.AssessmentRecommendationService;
import com.example.AssessRec.service.AssessmentRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;

@RestController
@RequestMapping("/api/recommend")
@RequiredArgsConstructor
public class RecommendationController {

    private final AssessmentRecommendationService recommendationService;
    private final AssessmentRetrievalService retrievalService;

    /**
     * Structured:
     *   {"jobTitle": "Software Engineer", "skills": ["Java"], "experienceLevel": "Mid", "topK": 5}
     * Free text:
     *   {"query": "Java developer who can lead a small team", "explain": false}
     */
    @PostMapping
    public Recommendation recommend(@RequestBody RecommendRequest request) {
        int topK = request.resolveTopK(retrievalService.defaultTopK());
        if (request.isStructured()) {
            return recommendationService.recommend(request.toQuery(), topK, request.resolveExplain());
        }
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("either jobTitle or query must be provided");
        }
        return recommendationService.recommend(request.query(), topK, request.resolveExplain());
    }

    @GetMapping
    public Recommendation recommendByQueryParam(
            @RequestParam("q") String query,
            @RequestParam(value = "explain", defaultValue = "true") boolean explain
    ) {
        return recommendationService.recommend(query, retrievalService.defaultTopK(), explain);
    }

    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody RecommendRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query must be provided");
        }
        SseEmitter emitter = new SseEmitter(0L);

        // Stages: start / retrieval / explanation | explanation_unavailable / done
        Flux<RecommendationEvent> stream = recommendationService.streamRecommendation(
                request.query(), request.resolveTopK(retrievalService.defaultTopK()));

        Disposable subscription = stream.subscribe(
                event -> {
                    try {
                        emitter.send(SseEmitter.event().name(event.stage()).data(event));
                    } catch (IOException e) {
                        emitter.completeWithError(e);
                    }
                },
                emitter::completeWithError,
                emitter::complete
        );

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());
        return emitter;
    }
}
