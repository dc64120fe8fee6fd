package com.prowl.kgindex.exception;

/**
 * Invalid service configuration. Fatal, never retried.
 */
public class ConfigurationException extends KnowledgeGraphException {

    public ConfigurationException(String message) {
        super(message);
    }
}
