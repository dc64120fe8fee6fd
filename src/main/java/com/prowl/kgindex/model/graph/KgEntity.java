package com.prowl.kgindex.model.graph;

import com.prowl.kgindex.core.EntityType;
import com.prowl.kgindex.core.ExtractedEntity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JPA Entity representing a node of the knowledge graph, scoped to the document that produced it.
 * Maps to table 'kg_entities'.
 */
@Entity
@Table(name = "kg_entities", indexes = {
        @Index(name = "idx_entity_document", columnList = "document_id, ordinal"),
        @Index(name = "idx_entity_text", columnList = "entity_text"),
        @Index(name = "idx_entity_type", columnList = "entity_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgEntity {

    @Id
    @Column(name = "entity_id", length = 64)
    private String entityId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private KgDocument document;

    @Column(name = "document_id", insertable = false, updatable = false)
    private String documentId;

    @Column(name = "entity_text", nullable = false, length = ExtractedEntity.MAX_TEXT_LENGTH)
    private String text;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_type", nullable = false, length = 32)
    private EntityType type;

    /** Insertion order within the owning document. */
    @Column(name = "ordinal", nullable = false)
    private int ordinal;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "entity_metadata", columnDefinition = "text")
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
