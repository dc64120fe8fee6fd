package com.prowl.kgindex.search;

import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Chunks ranked by similarity, plus the entities named by the query and the relations around them.
 */
@Value
@Builder
public class QueryResult {
    String query;
    List<ScoredChunk> chunks;
    List<KgEntity> entities;
    List<KgRelation> relations;
}
