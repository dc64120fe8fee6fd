package com.prowl.kgindex.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.util.List;

/**
 * JPA Entity representing one overlapping window of a document and its embedding.
 * Maps to table 'kg_chunks'.
 */
@Entity
@Table(name = "kg_chunks", indexes = {
        @Index(name = "idx_chunk_document", columnList = "document_id, chunk_index")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgChunk {

    @Id
    @Column(name = "chunk_id", length = 300)
    private String chunkId; // {documentId}_chunk_{chunkIndex}

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private KgDocument document;

    @Column(name = "document_id", insertable = false, updatable = false)
    private String documentId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", columnDefinition = "text")
    private List<Double> embedding;

    @Column(name = "embedding_degraded", nullable = false)
    private boolean embeddingDegraded;

    public static String chunkIdOf(String documentId, int chunkIndex) {
        return documentId + "_chunk_" + chunkIndex;
    }
}
