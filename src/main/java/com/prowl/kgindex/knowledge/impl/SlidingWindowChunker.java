package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.configuration.AppProperties;
import com.prowl.kgindex.core.TextChunk;
import com.prowl.kgindex.exception.ConfigurationException;
import com.prowl.kgindex.exception.ValidationException;
import com.prowl.kgindex.knowledge.Chunker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-based sliding window.
 *
 * Chunk {@code i} starts at {@code i * (chunkSize - overlap)} and is {@code chunkSize} long,
 * except the last one, which ends at the end of the text.
 */
@Slf4j
@Getter
@Component
public class SlidingWindowChunker implements Chunker {

    private final int chunkSize;
    private final int overlap;

    @Autowired
    public SlidingWindowChunker(AppProperties props) {
        this(props.getKnowledgeGraph().getChunkSize(), props.getKnowledgeGraph().getChunkOverlap());
    }

    public SlidingWindowChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Chunk size must be positive, got " + chunkSize);
        }
        if (overlap < 0) {
            throw new ConfigurationException("Chunk overlap must not be negative, got " + overlap);
        }
        if (overlap >= chunkSize) {
            throw new ConfigurationException(
                    "Chunk overlap (" + overlap + ") must be smaller than chunk size (" + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
        log.info("Chunker configured: size={}, overlap={}", chunkSize, overlap);
    }

    @Override
    public List<TextChunk> split(String text) {
        if (text == null || text.isEmpty()) {
            throw new ValidationException("Cannot chunk empty text");
        }

        List<TextChunk> chunks = new ArrayList<>();
        int step = chunkSize - overlap;
        int start = 0;
        while (true) {
            int end = Math.min(start + chunkSize, text.length());
            chunks.add(new TextChunk(chunks.size(), start, end, text.substring(start, end)));
            if (end == text.length()) {
                break;
            }
            start += step;
        }

        log.debug("Split {} chars into {} chunks", text.length(), chunks.size());
        return chunks;
    }

    /**
     * Rebuild the source text by dropping the overlapping prefix of every chunk after the first.
     */
    public static String reconstruct(List<TextChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        int covered = 0;
        for (TextChunk chunk : chunks) {
            sb.append(chunk.getText(), covered - chunk.getStart(), chunk.getText().length());
            covered = chunk.getEnd();
        }
        return sb.toString();
    }
}
