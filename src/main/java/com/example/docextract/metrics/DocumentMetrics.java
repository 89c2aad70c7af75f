package com.example.docextract.metrics;

import com.example.docextract.model.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики обработки документов.
 */
@Component
public class DocumentMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer totalDuration;
    private final Counter completedTotal;
    private final DistributionSummary pollAttempts;
    private final AtomicInteger activeTasks;

    public DocumentMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.totalDuration = Timer.builder("document.duration.total")
            .description("Total duration of document processing")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("document.completed.total")
            .description("Total number of completed documents")
            .register(meterRegistry);

        this.pollAttempts = DistributionSummary.builder("document.poll.attempts")
            .description("Status requests issued per analysis operation")
            .register(meterRegistry);

        this.activeTasks = new AtomicInteger(0);
        Gauge.builder("document.tasks.active", activeTasks, AtomicInteger::get)
            .description("Number of documents being processed")
            .register(meterRegistry);

        for (ErrorKind kind : ErrorKind.values()) {
            failedCounter(kind);
        }
    }

    /**
     * Создаёт Timer.Sample для измерения времени шага.
     */
    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTotalDuration(Timer.Sample sample) {
        sample.stop(totalDuration);
    }

    /**
     * Записывает время выполнения отдельного шага.
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("document.step.duration")
            .tag("step", stepName)
            .description("Duration of document processing step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    public void recordPollAttempts(int attempts) {
        pollAttempts.record(attempts);
    }

    public void incrementActiveTasks() {
        activeTasks.incrementAndGet();
    }

    public void decrementActiveTasks() {
        activeTasks.decrementAndGet();
    }

    public void recordCompleted() {
        completedTotal.increment();
    }

    /**
     * Отмечает неудачное завершение с типом ошибки.
     */
    public void recordFailed(ErrorKind kind) {
        failedCounter(kind).increment();
    }

    private Counter failedCounter(ErrorKind kind) {
        return Counter.builder("document.failed.total")
            .tag("kind", kind.name())
            .description("Total number of failed documents")
            .register(meterRegistry);
    }
}
