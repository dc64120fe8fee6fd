package com.prowl.kgindex.core;

import lombok.Value;

import java.util.List;

/**
 * Entities and relations extracted from one chunk. Relations only reference entities of the same result.
 */
@Value
public class ExtractionResult {
    List<ExtractedEntity> entities;
    List<ExtractedRelation> relations;
    boolean degraded;

    public ExtractionResult asDegraded() {
        return new ExtractionResult(entities, relations, true);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of(), false);
    }
}
