package com.prowl.kgindex.search.impl;

import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.exception.StorageException;
import com.prowl.kgindex.exception.ValidationException;
import com.prowl.kgindex.knowledge.EmbeddingProvider;
import com.prowl.kgindex.knowledge.GraphStore;
import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;
import com.prowl.kgindex.search.QueryResult;
import com.prowl.kgindex.search.QueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Default implementation of QueryService.
 *
 * Embeds the query with the same degrading provider used at ingest time, ranks chunks,
 * then merges substring and mention matches over entity text.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryServiceImpl implements QueryService {

    private final EmbeddingProvider embeddingProvider;
    private final GraphStore graphStore;

    @Override
    public QueryResult query(String query, int topK, boolean includeRelations) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query must not be empty");
        }
        if (topK < 1 || topK > MAX_TOP_K) {
            throw new ValidationException("topK must be between 1 and " + MAX_TOP_K + ", got " + topK);
        }

        long startTime = System.currentTimeMillis();
        log.info("Query: '{}' (topK={}, relations={})", query, topK, includeRelations);

        EmbeddingResult embedding = embeddingProvider.embed(query);
        if (embedding.isDegraded()) {
            log.warn("⚠️  Query embedding degraded to fallback");
        }

        try {
            List<ScoredChunk> chunks = graphStore.similaritySearch(embedding.getVector(), topK);
            List<KgEntity> entities = matchEntities(query, topK);

            List<KgRelation> relations = List.of();
            if (includeRelations && !entities.isEmpty()) {
                Set<String> entityIds = new LinkedHashSet<>();
                entities.forEach(entity -> entityIds.add(entity.getEntityId()));

                // Only documents that contributed chunks; relations never leak from other documents
                Set<String> documentIds = new LinkedHashSet<>();
                chunks.forEach(chunk -> documentIds.add(chunk.getDocumentId()));

                relations = graphStore.findRelationsTouching(entityIds, documentIds);
            }

            log.info("🟢 Query returned {} chunks, {} entities, {} relations in {}ms",
                    chunks.size(), entities.size(), relations.size(), System.currentTimeMillis() - startTime);

            return QueryResult.builder()
                    .query(query)
                    .chunks(chunks)
                    .entities(entities)
                    .relations(relations)
                    .build();

        } catch (DataAccessException | TransactionException e) {
            log.error("🔴 Query failed on storage: {}", e.getMessage());
            throw new StorageException("Query failed on storage", e);
        }
    }

    private List<KgEntity> matchEntities(String query, int topK) {
        Map<String, KgEntity> merged = new LinkedHashMap<>();
        for (KgEntity entity : graphStore.matchEntities(query, topK)) {
            merged.putIfAbsent(entity.getEntityId(), entity);
        }
        for (KgEntity entity : graphStore.findEntitiesMentionedIn(query, topK)) {
            if (merged.size() >= topK) {
                break;
            }
            merged.putIfAbsent(entity.getEntityId(), entity);
        }
        return List.copyOf(merged.values());
    }
}
