package com.prowl.kgindex.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Chunking, vector and extraction limits.
 *
 * <p>Overlap against chunk size is checked by the chunker itself so that the failure
 * carries the configuration error type.
 */
@Data
public class KnowledgeGraphProperties {

    private int chunkSize = 512;

    private int chunkOverlap = 50;

    @Min(1)
    private int embeddingDimension = 384;

    @Min(1)
    private int maxEntitiesPerChunk = 10;
}
