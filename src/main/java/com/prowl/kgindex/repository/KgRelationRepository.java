package com.prowl.kgindex.repository;

import com.prowl.kgindex.model.graph.KgRelation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for relations. Endpoints are fetched eagerly so callers can read entity text
 * after the transaction ends.
 */
@Repository
public interface KgRelationRepository extends JpaRepository<KgRelation, String> {

    @Query("SELECT r FROM KgRelation r JOIN FETCH r.source s JOIN FETCH r.target t " +
           "WHERE r.documentId = :documentId ORDER BY s.ordinal ASC, t.ordinal ASC")
    List<KgRelation> findByDocumentIdWithEndpoints(@Param("documentId") String documentId);

    /**
     * Relations whose source or target is one of {@code entityIds}, restricted to {@code documentIds}.
     */
    @Query("SELECT r FROM KgRelation r JOIN FETCH r.source s JOIN FETCH r.target t " +
           "WHERE r.documentId IN :documentIds " +
           "AND (r.sourceEntityId IN :entityIds OR r.targetEntityId IN :entityIds) " +
           "ORDER BY r.documentId ASC, s.ordinal ASC, t.ordinal ASC")
    List<KgRelation> findTouching(@Param("entityIds") Collection<String> entityIds,
                                  @Param("documentIds") Collection<String> documentIds);

    long countByDocumentId(String documentId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM KgRelation r WHERE r.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") String documentId);
}
