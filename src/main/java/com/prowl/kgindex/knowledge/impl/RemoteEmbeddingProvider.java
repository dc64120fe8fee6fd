package com.prowl.kgindex.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.prowl.kgindex.client.LLMProvider;
import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.exception.EmbeddingException;
import com.prowl.kgindex.knowledge.EmbeddingProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeddings from the remote service.
 *
 * Accepted response shapes:
 * <ul>
 *   <li>{@code {"data": [{"embedding": [...]}]}} (OpenAI / OpenRouter)</li>
 *   <li>{@code {"embedding": [...]}} (Ollama style)</li>
 *   <li>a bare JSON array</li>
 * </ul>
 * Anything else, including vectors of the wrong length, is an {@link EmbeddingException}.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteEmbeddingProvider implements EmbeddingProvider {

    private final LLMProvider llmProvider;
    private final int dimension;

    @Override
    public EmbeddingResult embed(String text) {
        JsonNode response = llmProvider.embed(text);
        List<Double> vector = toVector(locateVector(response));
        if (vector.size() != dimension) {
            throw new EmbeddingException("Expected " + dimension + " dimensions, got " + vector.size());
        }
        log.debug("🟢 [EMBEDDING RESPONSE] Dimensions={}", vector.size());
        return EmbeddingResult.of(vector);
    }

    static JsonNode locateVector(JsonNode response) {
        if (response == null || response.isNull() || response.isMissingNode()) {
            throw new EmbeddingException("Empty embedding response");
        }
        if (response.isArray()) {
            return response;
        }
        if (response.isObject()) {
            if (response.hasNonNull("error")) {
                throw new EmbeddingException("Embedding service error: " + response.get("error"));
            }
            JsonNode data = response.path("data");
            if (data.isArray() && data.size() > 0 && data.get(0).path("embedding").isArray()) {
                return data.get(0).path("embedding");
            }
            if (response.path("embedding").isArray()) {
                return response.path("embedding");
            }
        }
        throw new EmbeddingException("Unrecognized embedding response of type " + response.getNodeType());
    }

    private static List<Double> toVector(JsonNode array) {
        List<Double> vector = new ArrayList<>(array.size());
        for (JsonNode value : array) {
            if (!value.isNumber()) {
                throw new EmbeddingException("Embedding contains a non-numeric value: " + value);
            }
            vector.add(value.asDouble());
        }
        return vector;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getName() {
        return "remote:" + llmProvider.getProviderName();
    }
}
