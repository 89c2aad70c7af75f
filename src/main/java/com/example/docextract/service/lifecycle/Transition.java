package com.example.docextract.service.lifecycle;

import com.example.docextract.model.ExtractionPayload;
import com.example.docextract.model.LifecycleState;
import com.example.docextract.model.StoredObject;
import com.example.docextract.model.TaskError;
import com.example.docextract.model.TaskResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Запрошенный переход вместе с данными, которые он приносит в задачу.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Transition {
    LifecycleState target;
    StoredObject storedObject;
    String operationHandle;
    TaskResult result;

    /**
     * Переход без данных (UPLOADING, SUBMITTING, POLLING).
     */
    public static Transition to(LifecycleState target) {
        return new Transition(target, null, null, null);
    }

    public static Transition uploaded(StoredObject storedObject) {
        return new Transition(LifecycleState.UPLOADED, storedObject, null, null);
    }

    public static Transition submitted(String operationHandle) {
        return new Transition(LifecycleState.SUBMITTED, null, operationHandle, null);
    }

    public static Transition completed(ExtractionPayload payload) {
        return new Transition(LifecycleState.COMPLETED, null, null, TaskResult.success(payload));
    }

    public static Transition failed(TaskError error) {
        return new Transition(LifecycleState.FAILED, null, null, TaskResult.failure(error));
    }
}
