package com.prowl.kgindex.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends KnowledgeGraphException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document '" + documentId + "' not found");
        this.documentId = documentId;
    }
}
