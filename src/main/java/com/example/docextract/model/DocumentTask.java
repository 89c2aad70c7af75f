package com.example.docextract.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Снимок состояния задачи обработки документа.
 *
 * Снимки неизменяемы: каждый переход жизненного цикла создаёт новый экземпляр
 * через {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class DocumentTask {
    String id;
    LifecycleState state;
    String sourceFilename;
    String contentType;

    /**
     * Заполняется после успешной загрузки в хранилище
     */
    StoredObject storedObject;

    /**
     * Дескриптор операции анализа, заполняется после постановки
     */
    String operationHandle;

    /**
     * Заполняется только в терминальном состоянии
     */
    TaskResult result;

    Instant createdAt;
    Instant updatedAt;

    public String getStorageLocation() {
        return storedObject != null ? storedObject.getUrl() : null;
    }

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
}
