package com.alexandria.rag.exception;

import java.util.UUID;

public class DocumentNotFoundException extends EntityNotFoundException {

    public DocumentNotFoundException(UUID documentId) {
        super(documentId, "Document not found: " + documentId);
    }
}
