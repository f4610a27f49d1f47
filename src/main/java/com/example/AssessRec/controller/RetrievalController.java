package com.example.AssessRec.controller;

import com.example.AssessRec.model.RetrievalResult;
import com.example.AssessRec.service.AssessmentRetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RetrievalController {

    private final AssessmentRetrievalService retrievalService;

    /**
     * Retrieval only, no explanation.
     *   GET /api/retrieve?q=java developer&topK=5
     */
    @GetMapping("/retrieve")
    public List<RetrievalResult> retrieve(
            @RequestParam("q") String query,
            @RequestParam(value = "topK", required = false) Integer topK
    ) {
        int k = topK == null || topK <= 0 ? retrievalService.defaultTopK() : topK;
        return retrievalService.retrieve(query, k);
    }
}
