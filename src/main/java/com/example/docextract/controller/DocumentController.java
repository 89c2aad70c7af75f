package com.example.docextract.controller;

import com.example.docextract.dto.DocumentTaskMapper;
import com.example.docextract.dto.DocumentTaskResponse;
import com.example.docextract.dto.HealthResponse;
import com.example.docextract.dto.SubmissionResponse;
import com.example.docextract.exception.DocumentNotFoundException;
import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.LifecycleState;
import com.example.docextract.service.DocumentProcessingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * REST API для загрузки и анализа документов.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentProcessingService processingService;
    private final DocumentTaskMapper mapper;

    /**
     * Загружает и анализирует документ, ожидая результата.
     *
     * POST /api/v1/analyze
     */
    @PostMapping("/api/v1/analyze")
    public ResponseEntity<DocumentTaskResponse> analyze(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Received file upload: {} ({}, {} bytes)",
                file.getOriginalFilename(), file.getContentType(), file.getSize());

        DocumentTask task = processingService.submitBlocking(
                file.getBytes(), file.getOriginalFilename(), file.getContentType());
        return ResponseEntity.ok(mapper.toResponse(task));
    }

    /**
     * Ставит документ в фоновую обработку.
     *
     * POST /api/v1/analyze/async
     */
    @PostMapping("/api/v1/analyze/async")
    public ResponseEntity<SubmissionResponse> analyzeAsync(@RequestParam("file") MultipartFile file) throws IOException {
        String documentId = processingService.submitDetached(
                file.getBytes(), file.getOriginalFilename(), file.getContentType());
        log.info("Document {} queued for background processing", documentId);

        SubmissionResponse response = SubmissionResponse.builder()
                .documentId(documentId)
                .status(LifecycleState.QUEUED.name())
                .message("Document queued for processing. Check status using documentId.")
                .build();
        return ResponseEntity.accepted().body(response);
    }

    /**
     * Возвращает статус обработки.
     *
     * GET /api/v1/analyze/{documentId}
     */
    @GetMapping("/api/v1/analyze/{documentId}")
    public ResponseEntity<DocumentTaskResponse> getStatus(@PathVariable String documentId) {
        log.debug("Getting status for document: {}", documentId);

        DocumentTask task = processingService.queryStatus(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return ResponseEntity.ok(mapper.toResponse(task));
    }

    /**
     * Запрашивает отмену обработки.
     *
     * POST /api/v1/analyze/{documentId}/cancel
     */
    @PostMapping("/api/v1/analyze/{documentId}/cancel")
    public ResponseEntity<SubmissionResponse> cancel(@PathVariable String documentId) {
        DocumentTask task = processingService.queryStatus(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));

        boolean signalled = processingService.cancel(documentId);
        SubmissionResponse response = SubmissionResponse.builder()
                .documentId(documentId)
                .status(task.getState().name())
                .message(signalled ? "Cancellation requested" : "Document is not being processed")
                .build();
        return ResponseEntity.accepted().body(response);
    }

    /**
     * Удаляет завершённую задачу и загруженный файл.
     *
     * DELETE /api/v1/analyze/{documentId}
     */
    @DeleteMapping("/api/v1/analyze/{documentId}")
    public ResponseEntity<Void> discard(@PathVariable String documentId) {
        if (!processingService.discard(documentId)) {
            throw new DocumentNotFoundException(documentId);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/healthz")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok"));
    }
}
