package com.prowl.kgindex.exception;

public class EmbeddingException extends ProviderException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
