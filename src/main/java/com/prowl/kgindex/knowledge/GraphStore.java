package com.prowl.kgindex.knowledge;

import com.prowl.kgindex.core.EmbeddedChunk;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.model.graph.KgDocument;
import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Durable storage of documents, chunks, entities and relations.
 *
 * <p>Every write joins the caller's transaction when one is active, so a caller can group
 * the writes of one ingest into a single all-or-nothing unit. Storage failures surface as
 * {@link com.prowl.kgindex.exception.StorageException}.
 *
 * @since 1.0.0
 */
public interface GraphStore {

    // =========================================================================
    // Write Operations
    // =========================================================================

    /**
     * Insert a document, or replace it when the id exists. Replacing deletes the document's
     * relations, entities and chunks first.
     *
     * @return the stored document
     */
    KgDocument upsertDocument(String documentId, String title, String content, Map<String, Object> metadata);

    /**
     * Bulk insert chunks with their vectors, preserving ordinal order.
     *
     * @return number of chunks written
     */
    int insertChunks(String documentId, List<EmbeddedChunk> chunks);

    /**
     * Insert entities (assigning identifiers), then the relations between them.
     *
     * <p>If any relation names an entity key that is not in {@code entities}, no relation of the
     * batch is written; the entities are kept and the skip is reported in the result.
     */
    GraphWriteResult insertEntitiesAndRelations(String documentId,
                                                List<ExtractedEntity> entities,
                                                List<ExtractedRelation> relations);

    // =========================================================================
    // Query Operations
    // =========================================================================

    /**
     * Rank stored chunks by cosine similarity to the query vector, highest first.
     * Ties keep insertion order (document id, then chunk ordinal).
     */
    List<ScoredChunk> similaritySearch(List<Double> queryVector, int topK);

    /**
     * Entities whose text contains {@code text}, case-insensitively, across all documents.
     */
    List<KgEntity> matchEntities(String text, int topK);

    /**
     * Entities whose whole text occurs as a word sequence inside {@code text}, case-insensitively.
     */
    List<KgEntity> findEntitiesMentionedIn(String text, int topK);

    /**
     * Relations with source or target among {@code entityIds}, limited to {@code documentIds}.
     */
    List<KgRelation> findRelationsTouching(Collection<String> entityIds, Collection<String> documentIds);

    /**
     * @throws com.prowl.kgindex.exception.DocumentNotFoundException if the id is absent
     */
    DocumentGraph getDocumentGraph(String documentId);

    /**
     * Round-trip to the database.
     *
     * @throws com.prowl.kgindex.exception.StorageException if the store is unreachable
     */
    void ping();
}
