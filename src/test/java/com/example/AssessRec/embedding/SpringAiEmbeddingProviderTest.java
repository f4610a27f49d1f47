package com.example.AssessRec.embedding;

import com.example.AssessRec.config.RecommenderProperties;
import com.example.AssessRec.exception.EmbeddingUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiEmbeddingProviderTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private SpringAiEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        RecommenderProperties properties = new RecommenderProperties();
        properties.getEmbedding().setBatchSize(2);
        provider = new SpringAiEmbeddingProvider(embeddingModel, properties);
    }

    @Test
    @DisplayName("Texts are embedded in batches and returned in input order")
    void batchesInOrder() {
        when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(new float[]{1f}, new float[]{2f}));
        when(embeddingModel.embed(List.of("c"))).thenReturn(List.of(new float[]{3f}));

        List<float[]> vectors = provider.encodeAll(List.of("a", "b", "c"));

        assertThat(vectors).extracting(v -> v[0]).containsExactly(1f, 2f, 3f);
        verify(embeddingModel, times(2)).embed(anyList());
    }

    @Test
    @DisplayName("Model failures surface as an unavailable embedding model")
    void wrapsFailures() {
        when(embeddingModel.embed("java")).thenThrow(new RuntimeException("connection refused"));

        assertThatThrownBy(() -> provider.encode("java"))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasCauseInstanceOf(RuntimeException.class);
    }

    @Test
    @DisplayName("An empty vector is rejected")
    void rejectsEmptyVector() {
        when(embeddingModel.embed("java")).thenReturn(new float[0]);

        assertThatThrownBy(() -> provider.encode("java")).isInstanceOf(EmbeddingUnavailableException.class);
    }

    @Test
    @DisplayName("A batch answer of the wrong size is rejected")
    void rejectsShortBatch() {
        when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(new float[]{1f}));

        assertThatThrownBy(() -> provider.encodeAll(List.of("a", "b")))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("1 vectors for 2 texts");
    }

    @Test
    @DisplayName("No texts means no model call")
    void emptyInput() {
        assertThat(provider.encodeAll(List.of())).isEmpty();
    }
}
