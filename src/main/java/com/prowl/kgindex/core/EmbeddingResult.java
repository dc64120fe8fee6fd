package com.prowl.kgindex.core;

import lombok.Value;

import java.util.List;

/**
 * Embedding vector plus whether it came from the local fallback instead of the remote service.
 */
@Value
public class EmbeddingResult {
    List<Double> vector;
    boolean degraded;

    public static EmbeddingResult of(List<Double> vector) {
        return new EmbeddingResult(vector, false);
    }

    public static EmbeddingResult fallback(List<Double> vector) {
        return new EmbeddingResult(vector, true);
    }
}
