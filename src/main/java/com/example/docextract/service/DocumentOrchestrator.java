package com.example.docextract.service;

import com.example.docextract.config.PollingConfig;
import com.example.docextract.metrics.DocumentMetrics;
import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.ErrorKind;
import com.example.docextract.model.ExtractionPayload;
import com.example.docextract.model.LifecycleState;
import com.example.docextract.model.StoredObject;
import com.example.docextract.model.TaskError;
import com.example.docextract.service.analysis.AnalysisClient;
import com.example.docextract.service.lifecycle.DocumentLifecycle;
import com.example.docextract.service.lifecycle.InvalidTransitionException;
import com.example.docextract.service.lifecycle.Transition;
import com.example.docextract.service.polling.CancellationToken;
import com.example.docextract.service.polling.OperationOutcome;
import com.example.docextract.service.polling.OperationPoller;
import com.example.docextract.service.polling.PollPolicy;
import com.example.docextract.service.registry.StatusRegistry;
import com.example.docextract.service.storage.StorageClient;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Проводит документ через загрузку, постановку на анализ и опрос до терминального состояния.
 *
 * Каждый переход публикуется в {@link StatusRegistry}. Ошибки внешних сервисов
 * не выходят за пределы {@link #run}: они превращаются в FAILED с типом ошибки.
 */
@Slf4j
@Service
public class DocumentOrchestrator {

    private final StorageClient storageClient;
    private final AnalysisClient analysisClient;
    private final OperationPoller operationPoller;
    private final DocumentLifecycle lifecycle;
    private final StatusRegistry statusRegistry;
    private final DocumentMetrics metrics;
    private final TaskExecutor taskExecutor;
    private final PollPolicy pollPolicy;

    // Токены отмены задач, которые сейчас выполняются
    private final Map<String, CancellationToken> activeRuns = new ConcurrentHashMap<>();

    @Autowired
    public DocumentOrchestrator(StorageClient storageClient,
                                AnalysisClient analysisClient,
                                OperationPoller operationPoller,
                                DocumentLifecycle lifecycle,
                                StatusRegistry statusRegistry,
                                DocumentMetrics metrics,
                                @Qualifier("documentTaskExecutor") TaskExecutor taskExecutor,
                                PollingConfig pollingConfig) {
        this(storageClient, analysisClient, operationPoller, lifecycle, statusRegistry, metrics,
                taskExecutor, pollingConfig.toPolicy());
    }

    public DocumentOrchestrator(StorageClient storageClient,
                                AnalysisClient analysisClient,
                                OperationPoller operationPoller,
                                DocumentLifecycle lifecycle,
                                StatusRegistry statusRegistry,
                                DocumentMetrics metrics,
                                TaskExecutor taskExecutor,
                                PollPolicy pollPolicy) {
        this.storageClient = storageClient;
        this.analysisClient = analysisClient;
        this.operationPoller = operationPoller;
        this.lifecycle = lifecycle;
        this.statusRegistry = statusRegistry;
        this.metrics = metrics;
        this.taskExecutor = taskExecutor;
        this.pollPolicy = pollPolicy;
    }

    /**
     * Запускает обработку документа.
     *
     * @param content     содержимое файла
     * @param filename    исходное имя файла
     * @param contentType MIME тип
     * @param mode        BLOCKING - вернуть терминальный снимок, DETACHED - снимок в QUEUED
     * @return снимок задачи
     * @throws IllegalArgumentException при пустом содержимом или отсутствии имени/типа
     */
    public DocumentTask run(byte[] content, String filename, String contentType, ExecutionMode mode) {
        validate(content, filename, contentType, mode);

        DocumentTask task = lifecycle.create(UUID.randomUUID().toString(), filename, contentType);
        CancellationToken token = new CancellationToken();
        activeRuns.put(task.getId(), token);
        statusRegistry.put(task);
        log.info("Task {} queued: {} ({}, {} bytes, {})",
                task.getId(), filename, contentType, content.length, mode);

        if (mode == ExecutionMode.BLOCKING) {
            return execute(task, content, token);
        }

        try {
            taskExecutor.execute(() -> execute(task, content, token));
            return task;
        } catch (RejectedExecutionException e) {
            log.error("Task {} rejected by executor: {}", task.getId(), e.getMessage());
            activeRuns.remove(task.getId());
            DocumentTask failed = lifecycle.fail(task, TaskError.of(ErrorKind.REJECTED, e));
            statusRegistry.put(failed);
            metrics.recordFailed(ErrorKind.REJECTED);
            return failed;
        }
    }

    /**
     * Подаёт сигнал отмены выполняющейся задаче.
     *
     * @return true, если задача выполнялась и сигнал был подан
     */
    public boolean cancel(String taskId) {
        CancellationToken token = activeRuns.get(taskId);
        if (token == null) {
            return false;
        }
        log.info("Task {}: cancellation requested", taskId);
        token.cancel();
        return true;
    }

    public boolean isActive(String taskId) {
        return activeRuns.containsKey(taskId);
    }

    DocumentTask execute(DocumentTask task, byte[] content, CancellationToken token) {
        PipelineRun run = new PipelineRun(task, token);
        Timer.Sample totalSample = metrics.startTimer();
        metrics.incrementActiveTasks();

        Error fatal = null;
        try {
            upload(run, content);
            submit(run);
            poll(run);
        } catch (InvalidTransitionException e) {
            log.error("Task {}: lifecycle contract violated", task.getId(), e);
            run.fail(TaskError.of(ErrorKind.INVALID_TRANSITION, e));
        } catch (RuntimeException e) {
            log.error("Task {}: unexpected failure in state {}", task.getId(), run.current.getState(), e);
            run.fail(TaskError.of(failureKind(run.current.getState()), e));
        } catch (Error e) {
            log.error("Task {}: fatal error in state {}", task.getId(), run.current.getState(), e);
            run.fail(TaskError.of(failureKind(run.current.getState()), e));
            fatal = e;
        } finally {
            activeRuns.remove(task.getId());
            metrics.decrementActiveTasks();
            metrics.recordTotalDuration(totalSample);
        }

        DocumentTask result = run.current;
        if (result.getState() == LifecycleState.COMPLETED) {
            metrics.recordCompleted();
            log.info("Task {} completed: {} fields extracted",
                    result.getId(), result.getResult().getPayload().getFieldCount());
        } else {
            TaskError error = result.getResult().getError();
            metrics.recordFailed(error.getKind());
            log.warn("Task {} failed: {} - {}", result.getId(), error.getKind(), error.getMessage());
        }
        // FAILED уже опубликован, Error пробрасывается дальше
        if (fatal != null) {
            throw fatal;
        }
        return result;
    }

    private static ErrorKind failureKind(LifecycleState state) {
        return switch (state) {
            case UPLOADING -> ErrorKind.STORAGE_ERROR;
            case SUBMITTING -> ErrorKind.SUBMISSION_ERROR;
            case POLLING -> ErrorKind.POLLING_ERROR;
            default -> ErrorKind.INVALID_TRANSITION;
        };
    }

    private void upload(PipelineRun run, byte[] content) {
        if (run.stopIfCancelled("upload")) {
            return;
        }
        run.advance(Transition.to(LifecycleState.UPLOADING));

        Timer.Sample sample = metrics.startTimer();
        StoredObject stored;
        try {
            stored = storageClient.upload(content, run.current.getSourceFilename(), run.current.getContentType());
        } catch (RuntimeException e) {
            log.warn("Task {}: upload failed: {}", run.current.getId(), e.getMessage());
            run.fail(TaskError.of(ErrorKind.STORAGE_ERROR, e));
            return;
        } finally {
            metrics.recordStepDuration(sample, "upload");
        }
        run.advance(Transition.uploaded(stored));
    }

    private void submit(PipelineRun run) {
        if (run.current.isTerminal() || run.stopIfCancelled("submission")) {
            return;
        }
        run.advance(Transition.to(LifecycleState.SUBMITTING));

        Timer.Sample sample = metrics.startTimer();
        String operationHandle;
        try {
            operationHandle = analysisClient.submit(run.current.getStorageLocation());
        } catch (RuntimeException e) {
            log.warn("Task {}: submission failed: {}", run.current.getId(), e.getMessage());
            run.fail(TaskError.of(ErrorKind.SUBMISSION_ERROR, e));
            return;
        } finally {
            metrics.recordStepDuration(sample, "submit");
        }
        run.advance(Transition.submitted(operationHandle));
    }

    private void poll(PipelineRun run) {
        if (run.current.isTerminal() || run.stopIfCancelled("polling")) {
            return;
        }
        run.advance(Transition.to(LifecycleState.POLLING));

        String operationHandle = run.current.getOperationHandle();
        Timer.Sample sample = metrics.startTimer();
        OperationOutcome<ExtractionPayload> outcome = operationPoller.poll(
                () -> analysisClient.fetchStatus(operationHandle), pollPolicy, run.token);
        metrics.recordStepDuration(sample, "poll");
        metrics.recordPollAttempts(outcome.getAttempts());

        switch (outcome.getType()) {
            case SUCCEEDED -> run.advance(Transition.completed(
                    outcome.getPayload() != null ? outcome.getPayload() : ExtractionPayload.builder().build()));
            case FAILED -> run.fail(TaskError.of(ErrorKind.ANALYSIS_FAILED, outcome.getError()));
            case TIMED_OUT -> run.fail(TaskError.of(ErrorKind.TIMED_OUT, outcome.getError()));
            case CANCELLED -> run.fail(TaskError.of(ErrorKind.CANCELLED, outcome.getError()));
            case POLLING_ERROR -> run.fail(outcome.getCause() != null
                    ? TaskError.of(ErrorKind.POLLING_ERROR, outcome.getCause())
                    : TaskError.of(ErrorKind.POLLING_ERROR, outcome.getError()));
        }
    }

    private static void validate(byte[] content, String filename, String contentType, ExecutionMode mode) {
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("Document content must not be empty");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename must not be blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type must not be blank");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Execution mode must be specified");
        }
    }

    /**
     * Текущий снимок одной задачи внутри её конвейера. Используется только потоком конвейера.
     */
    private final class PipelineRun {
        private final CancellationToken token;
        private DocumentTask current;

        private PipelineRun(DocumentTask task, CancellationToken token) {
            this.current = task;
            this.token = token;
        }

        void advance(Transition transition) {
            current = lifecycle.apply(current, transition);
            statusRegistry.put(current);
            log.debug("Task {}: {}", current.getId(), current.getState());
        }

        void fail(TaskError error) {
            current = lifecycle.fail(current, error);
            statusRegistry.put(current);
        }

        boolean stopIfCancelled(String step) {
            if (!token.isCancelled()) {
                return false;
            }
            fail(TaskError.of(ErrorKind.CANCELLED, "Cancelled before " + step));
            return true;
        }
    }
}
