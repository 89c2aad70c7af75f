package com.example.docextract.service.lifecycle;

import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.LifecycleState;
import com.example.docextract.model.TaskError;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Машина состояний документа: допустимые переходы и построение новых снимков.
 *
 * Не выполняет ввода-вывода; время берётся из переданного {@link Clock}.
 */
@Component
@RequiredArgsConstructor
public class DocumentLifecycle {

    private final Clock clock;

    /**
     * Проверяет, допустим ли переход.
     *
     * @param from текущее состояние
     * @param to   целевое состояние
     * @return true для рёбер успешного пути и для перехода в FAILED из нетерминального состояния
     */
    public boolean canTransition(LifecycleState from, LifecycleState to) {
        if (from == null || to == null || from.isTerminal()) {
            return false;
        }
        return to == LifecycleState.FAILED || from.successor() == to;
    }

    /**
     * Создаёт новую задачу в состоянии QUEUED.
     */
    public DocumentTask create(String id, String sourceFilename, String contentType) {
        Instant now = clock.instant();
        return DocumentTask.builder()
                .id(id)
                .state(LifecycleState.QUEUED)
                .sourceFilename(sourceFilename)
                .contentType(contentType)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Применяет переход к снимку задачи.
     *
     * @param task       текущий снимок
     * @param transition целевое состояние и его данные
     * @return новый снимок
     * @throws InvalidTransitionException если переход недопустим или не содержит нужных данных
     */
    public DocumentTask apply(DocumentTask task, Transition transition) {
        LifecycleState from = task.getState();
        LifecycleState to = transition.getTarget();

        if (!canTransition(from, to)) {
            throw new InvalidTransitionException(task.getId(), from, to, "edge is not allowed");
        }

        DocumentTask.DocumentTaskBuilder next = task.toBuilder()
                .state(to)
                .updatedAt(nextTimestamp(task));

        switch (to) {
            case UPLOADED -> {
                if (transition.getStoredObject() == null || transition.getStoredObject().getUrl() == null) {
                    throw new InvalidTransitionException(task.getId(), from, to, "storage location is missing");
                }
                next.storedObject(transition.getStoredObject());
            }
            case SUBMITTED -> {
                if (transition.getOperationHandle() == null || transition.getOperationHandle().isBlank()) {
                    throw new InvalidTransitionException(task.getId(), from, to, "operation handle is missing");
                }
                next.operationHandle(transition.getOperationHandle());
            }
            case COMPLETED, FAILED -> {
                if (transition.getResult() == null) {
                    throw new InvalidTransitionException(task.getId(), from, to, "result is missing");
                }
                next.result(transition.getResult());
            }
            default -> {
                // UPLOADING, SUBMITTING, POLLING не несут данных
            }
        }
        return next.build();
    }

    /**
     * Переводит задачу в FAILED. Для терминальной задачи возвращает её без изменений.
     */
    public DocumentTask fail(DocumentTask task, TaskError error) {
        if (task.isTerminal()) {
            return task;
        }
        return apply(task, Transition.failed(error));
    }

    // updatedAt не должен идти назад даже при переводе системных часов
    private Instant nextTimestamp(DocumentTask task) {
        Instant now = clock.instant();
        Instant previous = task.getUpdatedAt();
        return previous != null && previous.isAfter(now) ? previous : now;
    }
}
