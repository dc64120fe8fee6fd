package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.EmbeddedChunk;
import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.core.ExtractedEntity;
import com.prowl.kgindex.core.ExtractedRelation;
import com.prowl.kgindex.core.ExtractionResult;
import com.prowl.kgindex.core.TextChunk;
import com.prowl.kgindex.exception.StorageException;
import com.prowl.kgindex.exception.ValidationException;
import com.prowl.kgindex.knowledge.Chunker;
import com.prowl.kgindex.knowledge.EmbeddingProvider;
import com.prowl.kgindex.knowledge.ExtractionProvider;
import com.prowl.kgindex.knowledge.GraphStore;
import com.prowl.kgindex.knowledge.GraphWriteResult;
import com.prowl.kgindex.knowledge.IngestionResult;
import com.prowl.kgindex.knowledge.IngestionService;
import com.prowl.kgindex.model.graph.KgDocument;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Default ingestion pipeline: chunk, embed and extract in parallel, merge, persist.
 *
 * Provider failures never fail an ingest; they show up in the degradation flags.
 * Storage failures roll back every write of the call.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class IngestionServiceImpl implements IngestionService {

    public static final String CHUNK_INDEX_KEY = "chunk_index";

    private final Chunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final ExtractionProvider extractionProvider;
    private final GraphStore graphStore;
    private final Executor ingestionExecutor;
    private final TransactionTemplate transactionTemplate;

    public IngestionServiceImpl(Chunker chunker,
                                EmbeddingProvider embeddingProvider,
                                ExtractionProvider extractionProvider,
                                GraphStore graphStore,
                                @Qualifier("ingestionExecutor") Executor ingestionExecutor,
                                PlatformTransactionManager transactionManager) {
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.extractionProvider = extractionProvider;
        this.graphStore = graphStore;
        this.ingestionExecutor = ingestionExecutor;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public IngestionResult ingest(String documentId, String content, String title, Map<String, Object> metadata) {
        if (documentId == null || documentId.isBlank()) {
            throw new ValidationException("documentId must not be empty");
        }
        if (documentId.length() > KgDocument.MAX_ID_LENGTH) {
            throw new ValidationException("documentId must be at most " + KgDocument.MAX_ID_LENGTH + " characters");
        }
        if (title != null && title.length() > KgDocument.MAX_TITLE_LENGTH) {
            throw new ValidationException("title must be at most " + KgDocument.MAX_TITLE_LENGTH + " characters");
        }
        if (content == null || content.isBlank()) {
            throw new ValidationException("content must not be empty");
        }

        long startTime = System.nanoTime();
        log.info("📥 Ingesting document {} ({} chars)", documentId, content.length());

        List<TextChunk> chunks = chunker.split(content);

        // Embedding and extraction of every chunk are independent tasks
        List<CompletableFuture<EmbeddingResult>> embeddings = new ArrayList<>(chunks.size());
        List<CompletableFuture<ExtractionResult>> extractions = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            embeddings.add(CompletableFuture.supplyAsync(() -> embeddingProvider.embed(chunk.getText()), ingestionExecutor));
            extractions.add(CompletableFuture.supplyAsync(() -> extractionProvider.extract(chunk.getText()), ingestionExecutor));
        }

        boolean embeddingDegraded = false;
        boolean extractionDegraded = false;
        List<EmbeddedChunk> embeddedChunks = new ArrayList<>(chunks.size());
        List<ExtractionResult> extracted = new ArrayList<>(chunks.size());

        for (int i = 0; i < chunks.size(); i++) {
            EmbeddingResult embedding = join(embeddings.get(i));
            ExtractionResult extraction = join(extractions.get(i));

            if (embedding.isDegraded()) {
                embeddingDegraded = true;
                log.warn("⚠️  Document {} chunk {}: embedding degraded to fallback", documentId, i);
            }
            if (extraction.isDegraded()) {
                extractionDegraded = true;
                log.warn("⚠️  Document {} chunk {}: extraction degraded to fallback", documentId, i);
            }
            log.debug("Chunk {}: {} entities, {} relations", i,
                    extraction.getEntities().size(), extraction.getRelations().size());

            embeddedChunks.add(new EmbeddedChunk(chunks.get(i), embedding));
            extracted.add(extraction);
        }

        GraphAssembly graph = GraphAssembly.of(extracted);
        if (graph.getRelationsDropped() > 0) {
            log.warn("⚠️  Document {}: dropped {} relations with missing endpoints", documentId, graph.getRelationsDropped());
        }

        Map<String, Object> documentMetadata = metadata != null ? metadata : Map.of();
        GraphWriteResult written = persist(documentId, content, title, documentMetadata, embeddedChunks, graph);

        double durationSeconds = (System.nanoTime() - startTime) / 1_000_000_000.0;
        IngestionResultImpl result = IngestionResultImpl.of(
                documentId,
                embeddedChunks.size(),
                written.getEntitiesCreated(),
                written.getRelationsCreated(),
                graph.getRelationsDropped() + written.getRelationsSkipped(),
                durationSeconds,
                embeddingDegraded,
                extractionDegraded);

        log.info("✅ Ingested document {}: {} chunks, {} entities, {} relations ({} dropped) in {}s [{}]",
                documentId, result.getChunksCreated(), result.getEntitiesCreated(), result.getRelationsCreated(),
                result.getRelationsDropped(), String.format("%.3f", durationSeconds), result.getStatus());
        return result;
    }

    private GraphWriteResult persist(String documentId,
                                     String content,
                                     String title,
                                     Map<String, Object> metadata,
                                     List<EmbeddedChunk> chunks,
                                     GraphAssembly graph) {
        try {
            return transactionTemplate.execute(status -> {
                graphStore.upsertDocument(documentId, title, content, metadata);
                graphStore.insertChunks(documentId, chunks);
                return graphStore.insertEntitiesAndRelations(documentId, graph.getEntities(), graph.getRelations());
            });
        } catch (StorageException e) {
            log.error("🔴 Ingest of {} rolled back: {}", documentId, e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("🔴 Ingest of {} rolled back: {}", documentId, e.getMessage());
            throw new StorageException("Failed to persist document " + documentId, e);
        }
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Entities and relations of a whole document, merged from the per-chunk results.
     *
     * <p>Entities are unique by key and remember the first chunk they were seen in.
     * Duplicate (source, target, type) edges collapse into one with the highest confidence.
     */
    @Value
    static class GraphAssembly {
        List<ExtractedEntity> entities;
        List<ExtractedRelation> relations;
        int relationsDropped;

        static GraphAssembly of(List<ExtractionResult> perChunk) {
            Map<String, ExtractedEntity> entities = new LinkedHashMap<>();
            for (int chunkIndex = 0; chunkIndex < perChunk.size(); chunkIndex++) {
                for (ExtractedEntity entity : perChunk.get(chunkIndex).getEntities()) {
                    if (entities.containsKey(entity.getKey())) {
                        continue;
                    }
                    Map<String, Object> metadata = new LinkedHashMap<>(entity.getMetadata());
                    metadata.put(CHUNK_INDEX_KEY, chunkIndex);
                    entities.put(entity.getKey(), entity.toBuilder().metadata(metadata).build());
                }
            }

            Map<String, ExtractedRelation> edges = new LinkedHashMap<>();
            int dropped = 0;
            for (ExtractionResult result : perChunk) {
                for (ExtractedRelation relation : result.getRelations()) {
                    if (!entities.containsKey(relation.getSourceKey()) || !entities.containsKey(relation.getTargetKey())) {
                        dropped++;
                        continue;
                    }
                    edges.merge(relation.edgeKey(), relation,
                            (kept, candidate) -> candidate.getConfidence() > kept.getConfidence() ? candidate : kept);
                }
            }

            return new GraphAssembly(new ArrayList<>(entities.values()), new ArrayList<>(edges.values()), dropped);
        }
    }
}
