package com.example.docextract.exception;

/**
 * Сбой запроса статуса операции анализа.
 */
public class AnalysisException extends DocumentProcessingException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
