package com.example.docextract.service.polling;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Итог опроса внешней операции.
 *
 * @param <T> тип полезной нагрузки успешной операции
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OperationOutcome<T> {
    Type type;
    T payload;
    String error;

    /**
     * Последнее исключение запроса статуса (для POLLING_ERROR)
     */
    Throwable cause;

    /**
     * Сколько раз был вызван запрос статуса
     */
    int attempts;

    public enum Type {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        POLLING_ERROR,
        CANCELLED
    }

    static <T> OperationOutcome<T> succeeded(T payload, int attempts) {
        return new OperationOutcome<>(Type.SUCCEEDED, payload, null, null, attempts);
    }

    static <T> OperationOutcome<T> failed(String error, int attempts) {
        return new OperationOutcome<>(Type.FAILED, null, error, null, attempts);
    }

    static <T> OperationOutcome<T> timedOut(String error, int attempts) {
        return new OperationOutcome<>(Type.TIMED_OUT, null, error, null, attempts);
    }

    static <T> OperationOutcome<T> pollingError(Throwable cause, int attempts) {
        String message = cause != null && cause.getMessage() != null
                ? cause.getMessage()
                : "Status request failed";
        return new OperationOutcome<>(Type.POLLING_ERROR, null, message, cause, attempts);
    }

    static <T> OperationOutcome<T> cancelled(int attempts) {
        return new OperationOutcome<>(Type.CANCELLED, null, "Cancelled while polling", null, attempts);
    }
}
