/**
 * Knowledge management: chunking, embeddings, entity extraction, graph storage and ingestion.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code Chunker} - Overlapping fixed-size windows</li>
 *   <li>{@code EmbeddingProvider} - Remote vectors with a hash-based fallback</li>
 *   <li>{@code ExtractionProvider} - LLM extraction with a pattern-based fallback</li>
 *   <li>{@code GraphStore} - Relational storage and lookups</li>
 *   <li>{@code IngestionService} - Document ingestion pipeline</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.prowl.kgindex.knowledge;
