package com.example.docextract.controller;

import com.example.docextract.dto.ErrorResponse;
import com.example.docextract.exception.DocumentBusyException;
import com.example.docextract.exception.DocumentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Преобразует исключения контроллеров в {@link ErrorResponse}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMissingPart(Exception ex) {
        log.warn("Missing request part: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Required file is missing", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Upload too large: {}", ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, "File too large", ex.getMessage());
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex) {
        log.warn("Malformed multipart request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed multipart request", ex.getMessage());
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(DocumentNotFoundException ex) {
        log.debug("Document not found: {}", ex.getDocumentId());
        return respond(HttpStatus.NOT_FOUND, "Document not found", ex.getDocumentId());
    }

    @ExceptionHandler(DocumentBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(DocumentBusyException ex) {
        log.warn("Document {} is still being processed", ex.getDocumentId());
        return respond(HttpStatus.CONFLICT, "Document is still being processed", ex.getDocumentId());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process document", ex.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, detail));
    }
}
