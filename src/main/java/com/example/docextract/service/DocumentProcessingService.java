package com.example.docextract.service;

import com.example.docextract.config.AppConfig;
import com.example.docextract.exception.DocumentBusyException;
import com.example.docextract.exception.StorageException;
import com.example.docextract.model.DocumentTask;
import com.example.docextract.service.registry.StatusRegistry;
import com.example.docextract.service.storage.StorageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Основной сервис для приёма документов и выдачи их статусов.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentProcessingService {

    private final DocumentOrchestrator orchestrator;
    private final StatusRegistry statusRegistry;
    private final StorageClient storageClient;
    private final AppConfig appConfig;

    /**
     * Обрабатывает документ синхронно.
     *
     * @param content     содержимое файла
     * @param filename    имя файла, может отсутствовать
     * @param contentType MIME тип, может отсутствовать
     * @return терминальный снимок задачи
     */
    public DocumentTask submitBlocking(byte[] content, String filename, String contentType) {
        return orchestrator.run(content, filenameOrDefault(filename), contentTypeOrDefault(contentType),
                ExecutionMode.BLOCKING);
    }

    /**
     * Ставит документ в фоновую обработку.
     *
     * @return ID задачи, по которому можно запрашивать статус
     */
    public String submitDetached(byte[] content, String filename, String contentType) {
        DocumentTask task = orchestrator.run(content, filenameOrDefault(filename),
                contentTypeOrDefault(contentType), ExecutionMode.DETACHED);
        return task.getId();
    }

    public Optional<DocumentTask> queryStatus(String documentId) {
        requireId(documentId);
        return statusRegistry.get(documentId);
    }

    /**
     * Подаёт сигнал отмены задаче.
     *
     * @return true, если задача ещё выполнялась
     */
    public boolean cancel(String documentId) {
        requireId(documentId);
        return orchestrator.cancel(documentId);
    }

    /**
     * Удаляет завершённую задачу из реестра вместе с загруженным файлом.
     *
     * @return false, если задача неизвестна
     * @throws DocumentBusyException если задача ещё выполняется
     */
    public boolean discard(String documentId) {
        requireId(documentId);
        Optional<DocumentTask> found = statusRegistry.get(documentId);
        if (found.isEmpty()) {
            return false;
        }

        DocumentTask task = found.get();
        if (!task.isTerminal() || orchestrator.isActive(documentId)) {
            throw new DocumentBusyException(documentId);
        }

        if (task.getStoredObject() != null) {
            try {
                storageClient.delete(task.getStoredObject());
            } catch (StorageException e) {
                log.warn("Failed to delete stored object {} for document {}: {}",
                        task.getStoredObject().getObjectName(), documentId, e.getMessage());
            }
        }

        statusRegistry.delete(documentId);
        log.info("Document {} discarded", documentId);
        return true;
    }

    private String filenameOrDefault(String filename) {
        return filename == null || filename.isBlank() ? appConfig.getDefaultFilename() : filename;
    }

    private String contentTypeOrDefault(String contentType) {
        return contentType == null || contentType.isBlank() ? appConfig.getDefaultContentType() : contentType;
    }

    private static void requireId(String documentId) {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document ID must not be blank");
        }
    }
}
