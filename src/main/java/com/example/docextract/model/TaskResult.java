package com.example.docextract.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Итог задачи: либо извлечённые данные, либо типизированная ошибка.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TaskResult {
    ExtractionPayload payload;
    TaskError error;

    public static TaskResult success(ExtractionPayload payload) {
        return new TaskResult(payload, null);
    }

    public static TaskResult failure(TaskError error) {
        return new TaskResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
