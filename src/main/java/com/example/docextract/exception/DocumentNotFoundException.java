package com.example.docextract.exception;

import lombok.Getter;

/**
 * Задача с указанным ID неизвестна.
 */
@Getter
public class DocumentNotFoundException extends RuntimeException {
    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super("Document not found: " + documentId);
        this.documentId = documentId;
    }
}
