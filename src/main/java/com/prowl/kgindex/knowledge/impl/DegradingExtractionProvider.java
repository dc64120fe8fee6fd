package com.prowl.kgindex.knowledge.impl;

import com.prowl.kgindex.core.ExtractionResult;
import com.prowl.kgindex.knowledge.ExtractionProvider;
import lombok.extern.slf4j.Slf4j;

/**
 * LLM extraction with per-call fallback to the pattern strategy.
 */
@Slf4j
public class DegradingExtractionProvider implements ExtractionProvider {

    private final ExtractionProvider remote;
    private final PatternExtractionProvider fallback;

    public DegradingExtractionProvider(ExtractionProvider remote, PatternExtractionProvider fallback) {
        this.remote = remote;
        this.fallback = fallback;
    }

    @Override
    public ExtractionResult extract(String text) {
        if (remote == null) {
            return fallback.extract(text);
        }
        try {
            return remote.extract(text);
        } catch (RuntimeException e) {
            log.warn("⚠️  LLM extraction failed, using pattern fallback: {}", e.getMessage());
            return fallback.extract(text).asDegraded();
        }
    }

    public boolean isRemoteConfigured() {
        return remote != null;
    }

    @Override
    public String getName() {
        return remote == null ? fallback.getName() : remote.getName() + " -> " + fallback.getName();
    }
}
