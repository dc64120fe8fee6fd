package com.prowl.kgindex.knowledge.impl;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Ints;
import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.knowledge.EmbeddingProvider;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic embedding derived from SHA-256 digests of the text.
 *
 * <p>Block {@code k} is {@code sha256(bigEndian(k) || utf8(text))}. Each digest is read as 16
 * unsigned 16-bit big-endian values, each mapped to {@code v / 65535 * 2 - 1}, until the vector
 * has the configured dimension. Same text, same vector, on every JVM.
 *
 * <p>Results are never flagged degraded here; the degrading wrapper does that when this
 * provider stands in for the remote one.
 */
public class HashEmbeddingProvider implements EmbeddingProvider {

    private final int dimension;

    public HashEmbeddingProvider(int dimension) {
        Preconditions.checkArgument(dimension > 0, "Embedding dimension must be positive: %s", dimension);
        this.dimension = dimension;
    }

    @Override
    public EmbeddingResult embed(String text) {
        return EmbeddingResult.of(vectorOf(text == null ? "" : text));
    }

    List<Double> vectorOf(String text) {
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        List<Double> vector = new ArrayList<>(dimension);
        int block = 0;
        while (vector.size() < dimension) {
            byte[] digest = Hashing.sha256().newHasher()
                    .putBytes(Ints.toByteArray(block++))
                    .putBytes(payload)
                    .hash()
                    .asBytes();
            for (int i = 0; i + 1 < digest.length && vector.size() < dimension; i += 2) {
                int value = ((digest[i] & 0xFF) << 8) | (digest[i + 1] & 0xFF);
                vector.add((value / 65535.0) * 2 - 1);
            }
        }
        return Collections.unmodifiableList(vector);
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getName() {
        return "sha256-hash";
    }
}
