package com.example.docextract.service.lifecycle;

import com.example.docextract.model.LifecycleState;
import lombok.Getter;

/**
 * Попытка недопустимого перехода жизненного цикла.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {
    private final String taskId;
    private final LifecycleState from;
    private final LifecycleState to;

    public InvalidTransitionException(String taskId, LifecycleState from, LifecycleState to, String reason) {
        super("Invalid transition " + from + " -> " + to + " for task " + taskId + ": " + reason);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }
}
