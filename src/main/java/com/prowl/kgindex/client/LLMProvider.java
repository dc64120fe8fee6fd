package com.prowl.kgindex.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Remote model service used for extraction (chat completion) and embeddings.
 *
 * Implementations handle provider-specific API details and raise
 * {@link com.prowl.kgindex.exception.ProviderException} subtypes on any failure.
 *
 * @since 1.0.0
 */
public interface LLMProvider {

    /**
     * Execute chat completion with the LLM.
     *
     * @param systemPrompt Instructions for the model
     * @param userPrompt The user message
     * @param temperature Sampling temperature, or {@code null} for the configured default
     * @return The assistant message content
     * @throws com.prowl.kgindex.exception.ExtractionException on timeout, error status or error body
     */
    String chat(String systemPrompt, String userPrompt, Double temperature);

    /**
     * Request an embedding for a single text.
     *
     * <p>The response body is returned as parsed JSON without interpreting its shape:
     * providers disagree on where the vector lives.
     *
     * @param text Text to embed
     * @return Raw JSON body
     * @throws com.prowl.kgindex.exception.EmbeddingException on timeout, error status or unparseable body
     */
    JsonNode embed(String text);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
