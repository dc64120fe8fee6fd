package com.prowl.kgindex.exception;

/**
 * Failure of a remote model provider (timeout, non-2xx status, malformed or rejected response).
 *
 * <p>Never reaches callers of the ingest or query operations: the degrading providers
 * catch it and run the local fallback instead.
 *
 * @since 1.0.0
 */
public abstract class ProviderException extends KnowledgeGraphException {

    protected ProviderException(String message) {
        super(message);
    }

    protected ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
