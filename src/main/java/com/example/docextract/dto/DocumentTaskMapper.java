package com.example.docextract.dto;

import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.ExtractionPayload;
import com.example.docextract.model.TaskError;
import com.example.docextract.model.TaskResult;
import org.springframework.stereotype.Component;

/**
 * Преобразует снимок задачи в DTO ответа.
 */
@Component
public class DocumentTaskMapper {

    public DocumentTaskResponse toResponse(DocumentTask task) {
        DocumentTaskResponse.DocumentTaskResponseBuilder builder = DocumentTaskResponse.builder()
                .documentId(task.getId())
                .status(task.getState())
                .filename(task.getSourceFilename())
                .contentType(task.getContentType())
                .storageUrl(task.getStorageLocation())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt());

        TaskResult result = task.getResult();
        if (result == null) {
            return builder.build();
        }

        if (result.isSuccess()) {
            ExtractionPayload payload = result.getPayload();
            builder.fields(payload.getFields())
                    .rawResult(payload.getRawResult());
        } else {
            TaskError error = result.getError();
            builder.errorKind(error.getKind())
                    .errorMessage(error.getMessage());
        }
        return builder.build();
    }
}
