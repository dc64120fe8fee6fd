package com.prowl.kgindex.knowledge;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of writing the entities and relations of one document.
 */
@Value
@Builder
public class GraphWriteResult {
    int entitiesCreated;
    int relationsCreated;
    int relationsSkipped;

    /** True when the relation batch referenced an entity outside the batch and was skipped. */
    boolean integrityViolation;
}
