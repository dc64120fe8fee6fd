package com.prowl.kgindex.repository;

import com.prowl.kgindex.model.graph.KgChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for document chunks.
 */
@Repository
public interface KgChunkRepository extends JpaRepository<KgChunk, String> {

    /**
     * All chunks of a document in ordinal order.
     */
    List<KgChunk> findByDocumentIdOrderByChunkIndexAsc(String documentId);

    /**
     * Id and vector of every chunk that has one, in insertion order (document id, then ordinal).
     * Similarity ranking relies on this order to break ties.
     */
    @Query("SELECT c.chunkId AS chunkId, c.documentId AS documentId, c.chunkIndex AS chunkIndex, " +
           "c.embedding AS embedding FROM KgChunk c WHERE c.embedding IS NOT NULL " +
           "ORDER BY c.documentId ASC, c.chunkIndex ASC")
    List<ChunkVector> findAllEmbeddedInInsertionOrder();

    long countByDocumentId(String documentId);

    /**
     * Bulk DELETE of a document's chunks. Entities and relations must be removed first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM KgChunk c WHERE c.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
