package com.example.AssessRec.controller;

import com.example.AssessRec.exception.CatalogIndexNotBuiltException;
import com.example.AssessRec.exception.EmbeddingUnavailableException;
import com.example.AssessRec.model.RetrievalResult;
import com.example.AssessRec.service.AssessmentRetrievalService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.example.AssessRec.support.CatalogFixtures.record;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RetrievalController.class)
class RetrievalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AssessmentRetrievalService retrievalService;

    @Test
    @DisplayName("Returns ranked results with the record fields inlined")
    void returnsResults() throws Exception {
        when(retrievalService.retrieve("java", 3)).thenReturn(List.of(
                new RetrievalResult(1, record("Java Test", "core java", "https://c/java"), 0.82)));

        mockMvc.perform(get("/api/retrieve").param("q", "java").param("topK", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rank").value(1))
                .andExpect(jsonPath("$[0].name").value("Java Test"))
                .andExpect(jsonPath("$[0].url").value("https://c/java"))
                .andExpect(jsonPath("$[0].similarityScore").value(0.82))
                .andExpect(jsonPath("$[0].fullText").doesNotExist());
    }

    @Test
    @DisplayName("Missing topK falls back to the configured default")
    void defaultTopK() throws Exception {
        when(retrievalService.defaultTopK()).thenReturn(10);
        when(retrievalService.retrieve("java", 10)).thenReturn(List.of());

        mockMvc.perform(get("/api/retrieve").param("q", "java"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    @DisplayName("Invalid input maps to 400")
    void badRequest() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt()))
                .thenThrow(new IllegalArgumentException("query text must not be blank"));

        mockMvc.perform(get("/api/retrieve").param("q", " ").param("topK", "3"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    @DisplayName("An unbuilt index maps to 409")
    void notBuilt() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt()))
                .thenThrow(new CatalogIndexNotBuiltException("memory"));

        mockMvc.perform(get("/api/retrieve").param("q", "java").param("topK", "3"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("index_not_built"));
    }

    @Test
    @DisplayName("An unreachable embedding model maps to 503")
    void embeddingUnavailable() throws Exception {
        when(retrievalService.retrieve(anyString(), anyInt()))
                .thenThrow(new EmbeddingUnavailableException("connection refused"));

        mockMvc.perform(get("/api/retrieve").param("q", "java").param("topK", "3"))
                .andExpect(status().isServiceUnavailable());
    }
}
