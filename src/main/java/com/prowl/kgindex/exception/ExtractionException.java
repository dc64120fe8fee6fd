package com.prowl.kgindex.exception;

public class ExtractionException extends ProviderException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
