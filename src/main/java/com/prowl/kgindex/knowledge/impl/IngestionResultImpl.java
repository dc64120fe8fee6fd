package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.knowledge.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Default implementation of IngestionResult.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResultImpl implements IngestionResult {

    private String documentId;
    private int chunksCreated;
    private int entitiesCreated;
    private int relationsCreated;
    private int relationsDropped;
    private double durationSeconds;
    private String status;
    private DegradationFlagsImpl degraded;

    public static IngestionResultImpl of(String documentId,
                                        int chunks,
                                        int entities,
                                        int relations,
                                        int relationsDropped,
                                        double durationSeconds,
                                        boolean embeddingDegraded,
                                        boolean extractionDegraded) {
        return IngestionResultImpl.builder()
            .documentId(documentId)
            .chunksCreated(chunks)
            .entitiesCreated(entities)
            .relationsCreated(relations)
            .relationsDropped(relationsDropped)
            .durationSeconds(durationSeconds)
            .status(embeddingDegraded || extractionDegraded ? STATUS_DEGRADED : STATUS_SUCCESS)
            .degraded(new DegradationFlagsImpl(embeddingDegraded, extractionDegraded))
            .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DegradationFlagsImpl implements DegradationFlags {
        private boolean embedding;
        private boolean extraction;
    }
}
