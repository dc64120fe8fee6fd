package com.prowl.kgindex.api;

import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.search.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Retrieval query response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private String query;

    @Builder.Default
    private List<ScoredChunk> chunks = new ArrayList<>();

    @Builder.Default
    private List<EntityView> entities = new ArrayList<>();

    @Builder.Default
    private List<RelationView> relations = new ArrayList<>();

    public static QueryResponse from(QueryResult result) {
        return QueryResponse.builder()
            .query(result.getQuery())
            .chunks(result.getChunks())
            .entities(result.getEntities().stream().map(EntityView::of).collect(Collectors.toList()))
            .relations(result.getRelations().stream().map(RelationView::of).collect(Collectors.toList()))
            .build();
    }
}
