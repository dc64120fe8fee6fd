package com.prowl.kgindex.api;

import com.prowl.kgindex.knowledge.DocumentGraph;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Full graph of one document.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentGraphResponse {

    private String documentId;
    private String title;
    private Map<String, Object> metadata;
    private List<EntityView> entities;
    private List<RelationView> relations;
    private Map<String, List<DocumentGraph.Edge>> adjacency;
    private long chunksCount;

    public static DocumentGraphResponse from(DocumentGraph graph) {
        return DocumentGraphResponse.builder()
            .documentId(graph.getDocumentId())
            .title(graph.getTitle())
            .metadata(graph.getMetadata())
            .entities(graph.getEntities().stream().map(EntityView::of).collect(Collectors.toList()))
            .relations(graph.getRelations().stream().map(RelationView::of).collect(Collectors.toList()))
            .adjacency(graph.adjacency())
            .chunksCount(graph.getChunksCount())
            .build();
    }
}
