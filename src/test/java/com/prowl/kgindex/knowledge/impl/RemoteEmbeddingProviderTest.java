package com.prowl.kgindex.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prowl.kgindex.client.LLMProvider;
import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.exception.EmbeddingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Response shape handling of the remote embedding strategy and its degrading wrapper.
 */
@DisplayName("Remote Embedding Provider Tests")
class RemoteEmbeddingProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static LLMProvider replying(String json) {
        return new LLMProvider() {
            @Override
            public String chat(String systemPrompt, String userPrompt, Double temperature) {
                throw new UnsupportedOperationException();
            }

            @Override
            public JsonNode embed(String text) {
                try {
                    return MAPPER.readTree(json);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }

            @Override
            public String getProviderName() {
                return "stub";
            }
        };
    }

    private static LLMProvider failing() {
        return new LLMProvider() {
            @Override
            public String chat(String systemPrompt, String userPrompt, Double temperature) {
                throw new UnsupportedOperationException();
            }

            @Override
            public JsonNode embed(String text) {
                throw new EmbeddingException("Embedding request failed: timed out");
            }

            @Override
            public String getProviderName() {
                return "down";
            }
        };
    }

    @Test
    @DisplayName("OpenAI-style data array is accepted")
    void embed_dataArrayShape_shouldReturnVector() {
        RemoteEmbeddingProvider provider = new RemoteEmbeddingProvider(
                replying("{\"object\":\"list\",\"data\":[{\"embedding\":[0.1,0.2,0.3],\"index\":0}]}"), 3);

        EmbeddingResult result = provider.embed("text");

        assertEquals(List.of(0.1, 0.2, 0.3), result.getVector());
        assertFalse(result.isDegraded());
    }

    @Test
    @DisplayName("Top-level embedding field and bare arrays are accepted")
    void embed_alternativeShapes_shouldReturnVector() {
        assertEquals(List.of(1.0, -1.0),
                new RemoteEmbeddingProvider(replying("{\"embedding\":[1,-1]}"), 2).embed("x").getVector());
        assertEquals(List.of(0.5, 0.25),
                new RemoteEmbeddingProvider(replying("[0.5,0.25]"), 2).embed("x").getVector());
    }

    @Test
    @DisplayName("Error bodies, strings and malformed vectors fail with EmbeddingException")
    void embed_unusableResponses_shouldFail() {
        assertThatThrownBy(() -> new RemoteEmbeddingProvider(replying("{\"error\":{\"message\":\"No endpoints found\"}}"), 3).embed("x"))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> new RemoteEmbeddingProvider(replying("\"not a vector\""), 3).embed("x"))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> new RemoteEmbeddingProvider(replying("{\"data\":[]}"), 3).embed("x"))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> new RemoteEmbeddingProvider(replying("[0.1,\"a\",0.3]"), 3).embed("x"))
                .isInstanceOf(EmbeddingException.class);
        assertThatThrownBy(() -> new RemoteEmbeddingProvider(replying("[0.1,0.2]"), 3).embed("x"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("dimensions");
    }

    @Test
    @DisplayName("Degrading wrapper falls back to the hash vector and flags it")
    void degrading_remoteFailure_shouldReturnFlaggedFallback() {
        HashEmbeddingProvider fallback = new HashEmbeddingProvider(3);
        DegradingEmbeddingProvider provider = new DegradingEmbeddingProvider(
                new RemoteEmbeddingProvider(failing(), 3), fallback);

        EmbeddingResult result = provider.embed("Neural networks");

        assertTrue(result.isDegraded());
        assertEquals(fallback.embed("Neural networks").getVector(), result.getVector());
    }

    @Test
    @DisplayName("Degrading wrapper passes remote vectors through unflagged")
    void degrading_remoteSuccess_shouldNotFlag() {
        DegradingEmbeddingProvider provider = new DegradingEmbeddingProvider(
                new RemoteEmbeddingProvider(replying("[0.0,1.0,0.0]"), 3), new HashEmbeddingProvider(3));

        EmbeddingResult result = provider.embed("anything");

        assertFalse(result.isDegraded());
        assertEquals(List.of(0.0, 1.0, 0.0), result.getVector());
        assertTrue(provider.isRemoteConfigured());
    }

    @Test
    @DisplayName("Without a remote strategy the hash vector is not flagged")
    void degrading_noRemote_shouldUseFallbackUnflagged() {
        DegradingEmbeddingProvider provider = new DegradingEmbeddingProvider(null, new HashEmbeddingProvider(8));

        EmbeddingResult result = provider.embed("anything");

        assertFalse(result.isDegraded());
        assertThat(result.getVector()).hasSize(8);
        assertFalse(provider.isRemoteConfigured());
    }

    @Test
    @DisplayName("Mismatched dimensions are rejected at construction")
    void degrading_dimensionMismatch_shouldFail() {
        assertThrows(IllegalArgumentException.class, () -> new DegradingEmbeddingProvider(
                new RemoteEmbeddingProvider(replying("[]"), 4), new HashEmbeddingProvider(3)));
    }
}
