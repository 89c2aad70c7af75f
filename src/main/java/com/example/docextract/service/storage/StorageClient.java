package com.example.docextract.service.storage;

import com.example.docextract.exception.StorageException;
import com.example.docextract.model.StoredObject;

/**
 * Внешнее хранилище загружаемых документов.
 */
public interface StorageClient {

    /**
     * Сохраняет файл и возвращает его URL.
     *
     * @throws StorageException при любой ошибке хранилища
     */
    StoredObject upload(byte[] content, String filename, String contentType);

    /**
     * Удаляет ранее сохранённый объект.
     *
     * @throws StorageException при любой ошибке хранилища
     */
    void delete(StoredObject storedObject);
}
