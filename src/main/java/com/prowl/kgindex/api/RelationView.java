package com.prowl.kgindex.api;

import com.prowl.kgindex.model.graph.KgRelation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Relation with both endpoints resolved to their text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationView {

    private String relationId;
    private String documentId;
    private String sourceEntityId;
    private String source;
    private String targetEntityId;
    private String target;
    private String type;
    private double confidence;

    public static RelationView of(KgRelation relation) {
        return RelationView.builder()
            .relationId(relation.getRelationId())
            .documentId(relation.getDocumentId())
            .sourceEntityId(relation.getSourceEntityId())
            .source(relation.getSource().getText())
            .targetEntityId(relation.getTargetEntityId())
            .target(relation.getTarget().getText())
            .type(relation.getRelationType())
            .confidence(relation.getConfidence())
            .build();
    }
}
