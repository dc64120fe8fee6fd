package com.prowl.kgindex.model.graph;

import com.prowl.kgindex.core.ExtractedRelation;
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
 * JPA Entity representing a directed, typed edge between two entities of the same document.
 * Maps to table 'kg_relations'.
 */
@Entity
@Table(name = "kg_relations", indexes = {
        @Index(name = "idx_relation_source_target", columnList = "source_entity_id, target_entity_id"),
        @Index(name = "idx_relation_type", columnList = "relation_type"),
        @Index(name = "idx_relation_document", columnList = "document_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KgRelation {

    @Id
    @Column(name = "relation_id", length = 64)
    private String relationId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "document_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private KgDocument document;

    @Column(name = "document_id", insertable = false, updatable = false)
    private String documentId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "source_entity_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private KgEntity source;

    @Column(name = "source_entity_id", insertable = false, updatable = false)
    private String sourceEntityId;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "target_entity_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private KgEntity target;

    @Column(name = "target_entity_id", insertable = false, updatable = false)
    private String targetEntityId;

    @Column(name = "relation_type", nullable = false, length = ExtractedRelation.MAX_TYPE_LENGTH)
    private String relationType;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "relation_metadata", columnDefinition = "text")
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
