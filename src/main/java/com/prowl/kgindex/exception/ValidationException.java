package com.prowl.kgindex.exception;

/**
 * Empty or out-of-range input to an ingest or query call.
 */
public class ValidationException extends KnowledgeGraphException {

    public ValidationException(String message) {
        super(message);
    }
}
