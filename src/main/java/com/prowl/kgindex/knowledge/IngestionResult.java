package com.prowl.kgindex.knowledge;

/**
 * Result of ingesting one document.
 *
 * @since 1.0.0
 */
public interface IngestionResult {

    String STATUS_SUCCESS = "success";
    String STATUS_DEGRADED = "degraded";

    String getDocumentId();
    int getChunksCreated();
    int getEntitiesCreated();
    int getRelationsCreated();

    /** Relations discarded because an endpoint was missing. */
    int getRelationsDropped();

    double getDurationSeconds();
    String getStatus();
    DegradationFlags getDegraded();

    /**
     * Which pipeline stages fell back to their local strategy for at least one chunk.
     */
    interface DegradationFlags {
        boolean isEmbedding();
        boolean isExtraction();
    }
}
