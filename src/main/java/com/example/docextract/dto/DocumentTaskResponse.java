package com.example.docextract.dto;

import com.example.docextract.model.ErrorKind;
import com.example.docextract.model.ExtractedField;
import com.example.docextract.model.LifecycleState;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ответ со статусом и результатом обработки документа.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentTaskResponse {
    /**
     * ID задачи обработки
     */
    private String documentId;

    /**
     * Текущее состояние жизненного цикла
     */
    private LifecycleState status;

    private String filename;

    private String contentType;

    /**
     * URL загруженного файла в хранилище
     */
    private String storageUrl;

    /**
     * Извлечённые поля (только для COMPLETED)
     */
    private List<ExtractedField> fields;

    private Map<String, Object> rawResult;

    /**
     * Тип ошибки (только для FAILED)
     */
    private ErrorKind errorKind;

    private String errorMessage;

    private Instant createdAt;

    private Instant updatedAt;
}
