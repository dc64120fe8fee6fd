package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.EmbeddingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Hash Embedding Provider Tests")
class HashEmbeddingProviderTest {

    private final HashEmbeddingProvider provider = new HashEmbeddingProvider(384);

    @Test
    @DisplayName("Same text gives the same vector, also from a new instance")
    void embed_shouldBeDeterministic() {
        // Given
        String text = "Machine learning is a subfield of artificial intelligence.";

        // When
        List<Double> first = provider.embed(text).getVector();
        List<Double> second = provider.embed(text).getVector();
        List<Double> fresh = new HashEmbeddingProvider(384).embed(text).getVector();

        // Then
        assertEquals(first, second);
        assertEquals(first, fresh);
    }

    @Test
    @DisplayName("Vector values are pinned to the SHA-256 counter construction")
    void embed_shouldMatchKnownDigestValues() {
        List<Double> vector = provider.embed("knowledge graph").getVector();

        assertEquals(0.07185473411154342, vector.get(0), 1e-12);
        assertEquals(0.9254749370565347, vector.get(1), 1e-12);
        assertEquals(-0.37547875181200885, vector.get(2), 1e-12);
        // First value of the second digest block
        assertEquals(0.336964980544747, vector.get(16), 1e-12);
        assertEquals(-0.8273594262607766, vector.get(17), 1e-12);
    }

    @Test
    @DisplayName("Vector has the configured dimension and values in [-1, 1]")
    void embed_shouldRespectDimensionAndRange() {
        EmbeddingResult result = new HashEmbeddingProvider(1000).embed("Docker and Kubernetes");

        assertEquals(1000, result.getVector().size());
        assertThat(result.getVector()).allSatisfy(v -> assertThat(v).isBetween(-1.0, 1.0));
        assertFalse(result.isDegraded());
    }

    @Test
    @DisplayName("Different texts give different vectors")
    void embed_differentTexts_shouldDiffer() {
        assertNotEquals(provider.embed("Python").getVector(), provider.embed("python").getVector());
    }

    @Test
    @DisplayName("Non-positive dimension is rejected")
    void constructor_invalidDimension_shouldFail() {
        assertThrows(IllegalArgumentException.class, () -> new HashEmbeddingProvider(0));
    }
}
