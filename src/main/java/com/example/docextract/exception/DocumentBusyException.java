package com.example.docextract.exception;

import lombok.Getter;

/**
 * Операция недоступна, пока задача ещё выполняется.
 */
@Getter
public class DocumentBusyException extends RuntimeException {
    private final String documentId;

    public DocumentBusyException(String documentId) {
        super("Document " + documentId + " is still being processed");
        this.documentId = documentId;
    }
}
