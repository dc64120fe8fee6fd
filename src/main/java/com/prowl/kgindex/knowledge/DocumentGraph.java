package com.prowl.kgindex.knowledge;

import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete graph of one document: its metadata, entities, relations and chunk count.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class DocumentGraph {

    String documentId;
    String title;
    Map<String, Object> metadata;
    List<KgEntity> entities;
    List<KgRelation> relations;
    long chunksCount;

    /**
     * Subject text to its outgoing (object text, relation type) edges, derived from the relation rows.
     * Recomputed on every call.
     */
    public Map<String, List<Edge>> adjacency() {
        Map<String, List<Edge>> adjacency = new LinkedHashMap<>();
        for (KgRelation relation : relations) {
            adjacency.computeIfAbsent(relation.getSource().getText(), key -> new ArrayList<>())
                    .add(new Edge(relation.getTarget().getText(), relation.getRelationType()));
        }
        return adjacency;
    }

    @Value
    public static class Edge {
        String object;
        String relationType;
    }
}
