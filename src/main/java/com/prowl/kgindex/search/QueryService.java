package com.prowl.kgindex.search;

/**
 * Retrieval over the knowledge graph.
 *
 * <p>Combines three signals:
 * <ul>
 *   <li>Vector similarity between the query and stored chunks</li>
 *   <li>Entities whose text matches or is mentioned by the query</li>
 *   <li>Relations touching those entities, within the documents of the returned chunks</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface QueryService {

    int MAX_TOP_K = 50;

    /**
     * Run a retrieval query.
     *
     * @param query Natural language query, must not be blank
     * @param topK Number of chunks (and at most entities) to return, between 1 and {@link #MAX_TOP_K}
     * @param includeRelations Whether to look up relations of the matched entities
     * @return Ranked chunks, matched entities and their relations; empty collections when nothing matches
     * @throws com.prowl.kgindex.exception.ValidationException on blank query or out-of-range topK
     */
    QueryResult query(String query, int topK, boolean includeRelations);
}
