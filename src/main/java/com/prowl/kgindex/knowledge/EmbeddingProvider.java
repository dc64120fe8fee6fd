package com.prowl.kgindex.knowledge;

import com.prowl.kgindex.core.EmbeddingResult;

/**
 * Turns text into a vector of fixed dimension.
 *
 * <p>Two strategies share this contract: a remote embedding service and a deterministic
 * hash-based fallback. The bean wired into the pipeline degrades from the first to the second
 * per call.
 *
 * @since 1.0.0
 */
public interface EmbeddingProvider {

    /**
     * Embed a text.
     *
     * @param text the text to embed
     * @return vector of length {@link #getDimension()}, flagged when produced by the fallback
     */
    EmbeddingResult embed(String text);

    int getDimension();

    String getName();
}
