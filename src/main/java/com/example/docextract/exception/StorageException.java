package com.example.docextract.exception;

/**
 * Ошибка внешнего хранилища файлов.
 */
public class StorageException extends DocumentProcessingException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
