package com.prowl.kgindex.repository;

import java.util.List;

/**
 * Chunk identity and vector without its text, read for similarity ranking.
 */
public interface ChunkVector {

    String getChunkId();

    String getDocumentId();

    Integer getChunkIndex();

    List<Double> getEmbedding();
}
