package com.prowl.kgindex.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prowl.kgindex.client.OpenRouterClient;
import com.prowl.kgindex.knowledge.impl.DegradingEmbeddingProvider;
import com.prowl.kgindex.knowledge.impl.DegradingExtractionProvider;
import com.prowl.kgindex.knowledge.impl.HashEmbeddingProvider;
import com.prowl.kgindex.knowledge.impl.LlmExtractionProvider;
import com.prowl.kgindex.knowledge.impl.PatternExtractionProvider;
import com.prowl.kgindex.knowledge.impl.RemoteEmbeddingProvider;
import com.prowl.kgindex.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the embedding and extraction strategies.
 *
 * The remote strategy of each stage exists only when its API key is configured. The fallback
 * is always present, so the pipeline never depends on a remote service being reachable.
 *
 * @since 1.0.0
 */
@Slf4j
@Configuration
public class ProviderConfiguration {

    @Bean
    public OpenRouterClient openRouterClient(AppProperties props, ObjectMapper objectMapper) {
        return new OpenRouterClient(props, objectMapper);
    }

    @Bean
    public DegradingEmbeddingProvider embeddingProvider(AppProperties props, OpenRouterClient client) {
        int dimension = props.getKnowledgeGraph().getEmbeddingDimension();
        HashEmbeddingProvider fallback = new HashEmbeddingProvider(dimension);

        RemoteEmbeddingProvider remote = null;
        if (props.getEmbedding().isRemoteEnabled()) {
            remote = new RemoteEmbeddingProvider(client, dimension);
        }

        DegradingEmbeddingProvider provider = new DegradingEmbeddingProvider(remote, fallback);
        log.info("🚀 Embedding provider configured: {}", provider.getName());
        if (remote == null) {
            log.info("   No embedding API key, vectors come from {} (dimension {})", fallback.getName(), dimension);
        }
        return provider;
    }

    @Bean
    public DegradingExtractionProvider extractionProvider(AppProperties props,
                                                          OpenRouterClient client,
                                                          PromptLibraryService promptLibrary,
                                                          ObjectMapper objectMapper) {
        int maxEntities = props.getKnowledgeGraph().getMaxEntitiesPerChunk();
        PatternExtractionProvider fallback = new PatternExtractionProvider(maxEntities);

        LlmExtractionProvider remote = null;
        if (props.getExtraction().isRemoteEnabled()) {
            remote = new LlmExtractionProvider(client, promptLibrary, objectMapper, maxEntities);
        }

        DegradingExtractionProvider provider = new DegradingExtractionProvider(remote, fallback);
        log.info("🚀 Extraction provider configured: {}", provider.getName());
        if (remote == null) {
            log.info("   No extraction API key, entities come from the {} strategy", fallback.getName());
        }
        return provider;
    }
}
