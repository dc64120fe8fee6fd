package com.prowl.kgindex.repository;

import com.prowl.kgindex.model.graph.KgDocument;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface KgDocumentRepository extends JpaRepository<KgDocument, String> {

    /**
     * Reads a document and holds a write lock on its row until the transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM KgDocument d WHERE d.documentId = :documentId")
    Optional<KgDocument> findForUpdate(@Param("documentId") String documentId);
}
