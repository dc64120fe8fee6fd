package com.prowl.kgindex.exception;

/**
 * Base type for every error raised by the knowledge graph index.
 *
 * @since 1.0.0
 */
public class KnowledgeGraphException extends RuntimeException {

    public KnowledgeGraphException(String message) {
        super(message);
    }

    public KnowledgeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
