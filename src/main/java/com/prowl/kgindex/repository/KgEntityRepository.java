package com.prowl.kgindex.repository;

import com.prowl.kgindex.model.graph.KgEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for knowledge graph entities.
 */
@Repository
public interface KgEntityRepository extends JpaRepository<KgEntity, String> {

    List<KgEntity> findByDocumentIdOrderByOrdinalAsc(String documentId);

    /**
     * Case-insensitive substring search over entity text, across all documents.
     * {@code text} must already be escaped with {@code !} as the LIKE escape character.
     */
    @Query("SELECT e FROM KgEntity e WHERE LOWER(e.text) LIKE LOWER(CONCAT('%', :text, '%')) ESCAPE '!' " +
           "ORDER BY e.documentId ASC, e.ordinal ASC")
    List<KgEntity> searchByText(@Param("text") String text, Pageable pageable);

    long countByDocumentId(String documentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM KgEntity e WHERE e.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
