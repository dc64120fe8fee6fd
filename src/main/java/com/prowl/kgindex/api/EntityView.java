package com.prowl.kgindex.api;

import com.prowl.kgindex.model.graph.KgEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityView {

    private String entityId;
    private String documentId;
    private String text;
    private String type;
    private Map<String, Object> metadata;

    public static EntityView of(KgEntity entity) {
        return EntityView.builder()
            .entityId(entity.getEntityId())
            .documentId(entity.getDocumentId())
            .text(entity.getText())
            .type(entity.getType().name())
            .metadata(entity.getMetadata())
            .build();
    }
}
