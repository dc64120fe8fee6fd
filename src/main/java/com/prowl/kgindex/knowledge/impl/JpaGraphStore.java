package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.EmbeddedChunk;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ScoredChunk;
import com.prowl.kgindex.exception.DocumentNotFoundException;
import com.prowl.kgindex.exception.StorageException;
import com.prowl.kgindex.knowledge.DocumentGraph;
import com.prowl.kgindex.knowledge.GraphStore;
import com.prowl.kgindex.knowledge.GraphWriteResult;
import com.prowl.kgindex.model.graph.KgChunk;
import com.prowl.kgindex.model.graph.KgDocument;
import com.prowl.kgindex.model.graph.KgEntity;
import com.prowl.kgindex.model.graph.KgRelation;
import com.prowl.kgindex.repository.ChunkVector;
import com.prowl.kgindex.repository.KgChunkRepository;
import com.prowl.kgindex.repository.KgDocumentRepository;
import com.prowl.kgindex.repository.KgEntityRepository;
import com.prowl.kgindex.repository.KgRelationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Relational implementation of GraphStore on Spring Data JPA.
 *
 * Vectors are stored as JSON text and ranked in memory, so the same schema works on PostgreSQL
 * and on the in-memory test database.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class JpaGraphStore implements GraphStore {

    // Upper bound on rows pulled per query token when looking for mentioned entities
    private static final int MENTION_CANDIDATES_PER_TOKEN = 500;
    private static final int MIN_MENTION_TOKEN_LENGTH = 3;

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}+#.]+");

    private final KgDocumentRepository documentRepository;
    private final KgChunkRepository chunkRepository;
    private final KgEntityRepository entityRepository;
    private final KgRelationRepository relationRepository;
    private final JdbcTemplate jdbcTemplate;

    // =========================================================================
    // Write Operations
    // =========================================================================

    @Override
    public KgDocument upsertDocument(String documentId, String title, String content, Map<String, Object> metadata) {
        return storage("upsert document " + documentId, () -> {
            Map<String, Object> meta = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();

            // Locks the row so a concurrent re-ingest of the same id waits until this one commits
            var existing = documentRepository.findForUpdate(documentId);
            if (existing.isEmpty()) {
                KgDocument document = KgDocument.builder()
                        .documentId(documentId)
                        .title(title)
                        .content(content)
                        .metadata(meta)
                        .build();
                log.debug("Inserting document {}", documentId);
                return documentRepository.saveAndFlush(document);
            }

            KgDocument document = existing.get();
            document.setTitle(title);
            document.setContent(content);
            document.setMetadata(meta);
            KgDocument saved = documentRepository.saveAndFlush(document);

            int relations = relationRepository.deleteByDocumentId(documentId);
            int entities = entityRepository.deleteByDocumentId(documentId);
            int chunks = chunkRepository.deleteByDocumentId(documentId);
            log.info("Replacing document {}: removed {} chunks, {} entities, {} relations",
                    documentId, chunks, entities, relations);
            return saved;
        });
    }

    @Override
    public int insertChunks(String documentId, List<EmbeddedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return 0;
        }
        return storage("insert chunks for " + documentId, () -> {
            KgDocument document = documentRepository.getReferenceById(documentId);

            List<KgChunk> rows = new ArrayList<>(chunks.size());
            chunks.stream()
                    .sorted(Comparator.comparingInt(c -> c.getChunk().getOrdinal()))
                    .forEach(embedded -> rows.add(KgChunk.builder()
                            .chunkId(KgChunk.chunkIdOf(documentId, embedded.getChunk().getOrdinal()))
                            .document(document)
                            .documentId(documentId)
                            .chunkIndex(embedded.getChunk().getOrdinal())
                            .content(embedded.getChunk().getText())
                            .embedding(embedded.getEmbedding() != null ? embedded.getEmbedding().getVector() : null)
                            .embeddingDegraded(embedded.getEmbedding() != null && embedded.getEmbedding().isDegraded())
                            .build()));

            chunkRepository.saveAll(rows);
            log.debug("Stored {} chunks for {}", rows.size(), documentId);
            return rows.size();
        });
    }

    @Override
    public GraphWriteResult insertEntitiesAndRelations(String documentId,
                                                       List<ExtractedEntity> entities,
                                                       List<ExtractedRelation> relations) {
        List<ExtractedEntity> entityBatch = entities != null ? entities : List.of();
        List<ExtractedRelation> relationBatch = relations != null ? relations : List.of();

        return storage("insert graph for " + documentId, () -> {
            KgDocument document = documentRepository.getReferenceById(documentId);

            Map<String, KgEntity> rowsByKey = new LinkedHashMap<>();
            int ordinal = 0;
            for (ExtractedEntity entity : entityBatch) {
                if (rowsByKey.containsKey(entity.getKey())) {
                    continue;
                }
                rowsByKey.put(entity.getKey(), KgEntity.builder()
                        .entityId(UUID.randomUUID().toString())
                        .document(document)
                        .documentId(documentId)
                        .text(entity.getText())
                        .type(entity.getType())
                        .ordinal(ordinal++)
                        .metadata(new LinkedHashMap<>(entity.getMetadata()))
                        .build());
            }

            // saveAll merges rows with assigned ids; keep the managed copies for the relation endpoints
            List<String> keys = new ArrayList<>(rowsByKey.keySet());
            List<KgEntity> saved = entityRepository.saveAll(rowsByKey.values());
            Map<String, KgEntity> managedByKey = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                managedByKey.put(keys.get(i), saved.get(i));
            }

            List<ExtractedRelation> dangling = relationBatch.stream()
                    .filter(r -> !managedByKey.containsKey(r.getSourceKey()) || !managedByKey.containsKey(r.getTargetKey()))
                    .toList();
            if (!dangling.isEmpty()) {
                log.warn("⚠️  {} of {} relations for {} reference unknown entities, skipping relation batch",
                        dangling.size(), relationBatch.size(), documentId);
                return GraphWriteResult.builder()
                        .entitiesCreated(saved.size())
                        .relationsCreated(0)
                        .relationsSkipped(relationBatch.size())
                        .integrityViolation(true)
                        .build();
            }

            List<KgRelation> relationRows = new ArrayList<>(relationBatch.size());
            for (ExtractedRelation relation : relationBatch) {
                KgEntity source = managedByKey.get(relation.getSourceKey());
                KgEntity target = managedByKey.get(relation.getTargetKey());
                relationRows.add(KgRelation.builder()
                        .relationId(UUID.randomUUID().toString())
                        .document(document)
                        .documentId(documentId)
                        .source(source)
                        .sourceEntityId(source.getEntityId())
                        .target(target)
                        .targetEntityId(target.getEntityId())
                        .relationType(relation.getType())
                        .confidence(relation.getConfidence())
                        .build());
            }
            relationRepository.saveAll(relationRows);

            log.debug("Stored {} entities and {} relations for {}", saved.size(), relationRows.size(), documentId);
            return GraphWriteResult.builder()
                    .entitiesCreated(saved.size())
                    .relationsCreated(relationRows.size())
                    .relationsSkipped(0)
                    .integrityViolation(false)
                    .build();
        });
    }

    // =========================================================================
    // Query Operations
    // =========================================================================

    @Override
    @Transactional(readOnly = true)
    public List<ScoredChunk> similaritySearch(List<Double> queryVector, int topK) {
        if (queryVector == null || queryVector.isEmpty() || topK <= 0) {
            return List.of();
        }
        return storage("similarity search", () -> {
            List<ScoredChunk> scored = new ArrayList<>();
            for (ChunkVector chunk : chunkRepository.findAllEmbeddedInInsertionOrder()) {
                scored.add(ScoredChunk.builder()
                        .chunkId(chunk.getChunkId())
                        .documentId(chunk.getDocumentId())
                        .chunkIndex(chunk.getChunkIndex())
                        .score(cosineSimilarity(queryVector, chunk.getEmbedding()))
                        .build());
            }

            // List.sort is stable: equal scores keep (document id, ordinal) order
            scored.sort(Comparator.comparingDouble(ScoredChunk::getScore).reversed());
            List<ScoredChunk> top = scored.size() > topK ? new ArrayList<>(scored.subList(0, topK)) : scored;

            // Text is only loaded for the chunks that are returned
            Map<String, String> contentById = new HashMap<>();
            chunkRepository.findAllById(top.stream().map(ScoredChunk::getChunkId).toList())
                    .forEach(chunk -> contentById.put(chunk.getChunkId(), chunk.getContent()));
            top.forEach(chunk -> chunk.setContent(contentById.get(chunk.getChunkId())));
            return top;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgEntity> matchEntities(String text, int topK) {
        if (text == null || text.isBlank() || topK <= 0) {
            return List.of();
        }
        return storage("match entities", () -> entityRepository.searchByText(escapeLike(text.trim()), PageRequest.of(0, topK)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgEntity> findEntitiesMentionedIn(String text, int topK) {
        if (text == null || text.isBlank() || topK <= 0) {
            return List.of();
        }
        String haystack = text.toLowerCase(Locale.ROOT);

        Set<String> tokens = new LinkedHashSet<>();
        for (String token : TOKEN_SEPARATOR.split(haystack)) {
            String cleaned = token.replaceAll("^\\.+|\\.+$", "");
            if (cleaned.length() >= MIN_MENTION_TOKEN_LENGTH) {
                tokens.add(cleaned);
            }
        }
        if (tokens.isEmpty()) {
            return List.of();
        }

        return storage("find mentioned entities", () -> {
            Map<String, KgEntity> candidates = new LinkedHashMap<>();
            for (String token : tokens) {
                for (KgEntity entity : entityRepository.searchByText(escapeLike(token), PageRequest.of(0, MENTION_CANDIDATES_PER_TOKEN))) {
                    candidates.putIfAbsent(entity.getEntityId(), entity);
                }
            }

            return candidates.values().stream()
                    .filter(entity -> mentions(haystack, entity.getText()))
                    .sorted(Comparator.comparing(KgEntity::getDocumentId).thenComparingInt(KgEntity::getOrdinal))
                    .limit(topK)
                    .toList();
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<KgRelation> findRelationsTouching(Collection<String> entityIds, Collection<String> documentIds) {
        if (entityIds == null || entityIds.isEmpty() || documentIds == null || documentIds.isEmpty()) {
            return List.of();
        }
        return storage("find relations", () -> relationRepository.findTouching(entityIds, documentIds));
    }

    @Override
    @Transactional(readOnly = true)
    public DocumentGraph getDocumentGraph(String documentId) {
        KgDocument document = storage("load document " + documentId, () -> documentRepository.findById(documentId))
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        return storage("load graph " + documentId, () -> DocumentGraph.builder()
                .documentId(document.getDocumentId())
                .title(document.getTitle())
                .metadata(document.getMetadata() != null ? new LinkedHashMap<>(document.getMetadata()) : Map.of())
                .entities(entityRepository.findByDocumentIdOrderByOrdinalAsc(documentId))
                .relations(relationRepository.findByDocumentIdWithEndpoints(documentId))
                .chunksCount(chunkRepository.countByDocumentId(documentId))
                .build());
    }

    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public void ping() {
        storage("ping", () -> jdbcTemplate.queryForObject("SELECT 1", Integer.class));
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static double cosineSimilarity(List<Double> a, List<Double> b) {
        if (a == null || b == null || a.size() != b.size() || a.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Escapes LIKE wildcards so user text matches literally; pairs with {@code ESCAPE '!'} in the query.
     */
    static String escapeLike(String text) {
        return text.replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }

    static boolean mentions(String lowerCaseText, String entityText) {
        String needle = entityText.toLowerCase(Locale.ROOT);
        if (needle.isBlank()) {
            return false;
        }
        return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(needle) + "(?![\\p{L}\\p{N}])")
                .matcher(lowerCaseText)
                .find();
    }

    private <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("🔴 Storage failure during {}: {}", operation, e.getMessage());
            throw new StorageException("Storage failure during " + operation, e);
        }
    }
}
