package com.prowl.kgindex.knowledge;

import java.util.Map;

/**
 * Ingests documents into the knowledge graph.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Split content into overlapping chunks</li>
 *   <li>Embed and extract every chunk independently, degrading to local fallbacks</li>
 *   <li>Deduplicate entities across chunks</li>
 *   <li>Replace the document's graph in one transaction</li>
 * </ol>
 *
 * @since 1.0.0
 */
public interface IngestionService {

    /**
     * Ingest (or re-ingest) a document.
     *
     * @param documentId caller-supplied unique id
     * @param content raw text, must not be blank
     * @param title optional title
     * @param metadata optional metadata
     * @return counts, duration and degradation flags
     * @throws com.prowl.kgindex.exception.ValidationException if id or content is blank
     * @throws com.prowl.kgindex.exception.StorageException if persisting fails; nothing is committed
     */
    IngestionResult ingest(String documentId, String content, String title, Map<String, Object> metadata);
}
