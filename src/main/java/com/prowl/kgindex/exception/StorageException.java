package com.prowl.kgindex.exception;

/**
 * Failure reading or writing the durable store. The current operation is aborted
 * and its transaction rolled back.
 */
public class StorageException extends KnowledgeGraphException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
