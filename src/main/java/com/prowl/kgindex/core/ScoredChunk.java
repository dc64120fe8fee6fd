package com.prowl.kgindex.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Chunk returned by similarity search together with its cosine similarity to the query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredChunk {
    private String chunkId;
    private String documentId;
    private int chunkIndex;
    private String content;
    private double score;
}
