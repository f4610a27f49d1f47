package com.example.AssessRec.embedding;

import java.util.List;

/**
 * Text to fixed-dimension vector. Implementations must be deterministic for a fixed
 * model version and must not mutate shared state.
 */
public interface EmbeddingProvider {

    float[] encode(String text);

    /**
     * Batch variant of {@link #encode}. The returned list is index-aligned with {@code texts}.
     */
    List<float[]> encodeAll(List<String> texts);
}
