package com.prowl.kgindex.api;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Retrieval query request.
 *
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    public static final int DEFAULT_TOP_K = 5;

    private String query;
    private Integer topK = DEFAULT_TOP_K;
    private Boolean includeRelations = Boolean.TRUE;

    public int resolvedTopK() {
        return topK != null ? topK : DEFAULT_TOP_K;
    }

    public boolean resolvedIncludeRelations() {
        return includeRelations == null || includeRelations;
    }
}
