package com.prowl.kgindex.knowledge;

import com.prowl.kgindex.core.TextChunk;

import java.util.List;

/**
 * Splits document text into ordered, overlapping windows.
 *
 * @since 1.0.0
 */
public interface Chunker {

    /**
     * Split text into chunks covering the whole input.
     *
     * @param text Document text (non-empty)
     * @return Ordered, non-empty list of chunks; identical input always yields identical boundaries
     */
    List<TextChunk> split(String text);

    int getChunkSize();

    int getOverlap();
}
