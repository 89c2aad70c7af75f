package com.example.docextract.model;

import lombok.Builder;
import lombok.Value;

/**
 * Описание ошибки, завершившей задачу.
 */
@Value
@Builder
public class TaskError {
    ErrorKind kind;
    String message;

    /**
     * Имя класса исходного исключения (если было)
     */
    String causeType;

    public static TaskError of(ErrorKind kind, String message) {
        return TaskError.builder()
                .kind(kind)
                .message(message)
                .build();
    }

    public static TaskError of(ErrorKind kind, Throwable cause) {
        return TaskError.builder()
                .kind(kind)
                .message(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName())
                .causeType(cause.getClass().getName())
                .build();
    }
}
