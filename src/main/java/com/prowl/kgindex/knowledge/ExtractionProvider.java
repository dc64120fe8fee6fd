package com.prowl.kgindex.knowledge;

import com.prowl.kgindex.core.ExtractionResult;

/**
 * Turns a chunk of text into entities and the relations between them.
 *
 * <p>Entities of one result are unique by (normalized text, type) and every relation
 * references entities of the same result.
 *
 * @since 1.0.0
 */
public interface ExtractionProvider {

    ExtractionResult extract(String text);

    String getName();
}
