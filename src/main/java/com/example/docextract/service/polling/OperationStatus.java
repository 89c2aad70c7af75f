package com.example.docextract.service.polling;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Ответ на один запрос статуса внешней операции.
 *
 * @param <T> тип полезной нагрузки успешной операции
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationStatus<T> {
    OperationStage stage;
    T payload;
    String error;

    public static <T> OperationStatus<T> running() {
        return new OperationStatus<>(OperationStage.RUNNING, null, null);
    }

    public static <T> OperationStatus<T> succeeded(T payload) {
        return new OperationStatus<>(OperationStage.SUCCEEDED, payload, null);
    }

    public static <T> OperationStatus<T> failed(String error) {
        return new OperationStatus<>(OperationStage.FAILED, null, error);
    }
}
