package com.prowl.kgindex.api;

import com.prowl.kgindex.knowledge.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Ingest document response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

    private String documentId;
    private int chunksCreated;
    private int entitiesCreated;
    private int relationsCreated;
    private int relationsDropped;
    private double durationSeconds;
    private String status;
    private Degraded degraded;

    public static IngestResponse from(IngestionResult result) {
        return IngestResponse.builder()
            .documentId(result.getDocumentId())
            .chunksCreated(result.getChunksCreated())
            .entitiesCreated(result.getEntitiesCreated())
            .relationsCreated(result.getRelationsCreated())
            .relationsDropped(result.getRelationsDropped())
            .durationSeconds(result.getDurationSeconds())
            .status(result.getStatus())
            .degraded(new Degraded(result.getDegraded().isEmbedding(), result.getDegraded().isExtraction()))
            .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Degraded {
        private boolean embedding;
        private boolean extraction;
    }
}
