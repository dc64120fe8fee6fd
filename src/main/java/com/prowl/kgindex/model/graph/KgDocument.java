package com.prowl.kgindex.model.graph;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA Entity representing an ingested document, the owner of all chunks, entities and relations.
 * Maps to table 'kg_documents'.
 */
@Entity
@Table(name = "kg_documents")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgDocument {

    public static final int MAX_ID_LENGTH = 255;
    public static final int MAX_TITLE_LENGTH = 512;

    @Id
    @Column(name = "document_id", length = MAX_ID_LENGTH)
    private String documentId;

    @Column(name = "title", length = MAX_TITLE_LENGTH)
    private String title;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "doc_metadata", columnDefinition = "text")
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    public void onCreate() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    public void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }
}
