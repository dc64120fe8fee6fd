package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.EmbeddingResult;
import com.prowl.kgindex.knowledge.EmbeddingProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * Remote embeddings with per-call fallback to the hash strategy.
 *
 * Without a remote strategy every call goes to the fallback and is not flagged: nothing was
 * attempted, so nothing degraded.
 */
@Slf4j
public class DegradingEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider remote;
    private final HashEmbeddingProvider fallback;

    public DegradingEmbeddingProvider(EmbeddingProvider remote, HashEmbeddingProvider fallback) {
        if (remote != null && remote.getDimension() != fallback.getDimension()) {
            throw new IllegalArgumentException("Remote and fallback embedding dimensions differ");
        }
        this.remote = remote;
        this.fallback = fallback;
    }

    @Override
    public EmbeddingResult embed(String text) {
        if (remote == null) {
            return fallback.embed(text);
        }
        try {
            return remote.embed(text);
        } catch (RuntimeException e) {
            log.warn("⚠️  Remote embedding failed, using hash fallback: {}", e.getMessage());
            return EmbeddingResult.fallback(fallback.embed(text).getVector());
        }
    }

    public boolean isRemoteConfigured() {
        return remote != null;
    }

    @Override
    public int getDimension() {
        return fallback.getDimension();
    }

    @Override
    public String getName() {
        return remote == null ? fallback.getName() : remote.getName() + " -> " + fallback.getName();
    }
}
