package com.example.docextract.exception;

/**
 * Сервис анализа не принял документ.
 */
public class SubmissionException extends DocumentProcessingException {

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
