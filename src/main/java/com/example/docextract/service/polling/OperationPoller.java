package com.example.docextract.service.polling;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Опрашивает внешнюю длительную операцию до терминальной стадии или исчерпания бюджета.
 *
 * Не хранит состояния конкретной задачи и может одновременно использоваться
 * из нескольких потоков.
 */
@Slf4j
public class OperationPoller {

    private final Clock clock;
    private final Sleeper sleeper;

    public OperationPoller(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> OperationOutcome<T> poll(Supplier<OperationStatus<T>> fetchStatus, PollPolicy policy) {
        return poll(fetchStatus, policy, CancellationToken.none());
    }

    /**
     * Опрашивает операцию.
     *
     * @param fetchStatus запрос текущего статуса; исключение считается временным сбоем
     * @param policy      параметры задержек и ограничений
     * @param token       сигнал отмены, проверяется перед каждым запросом и каждой паузой
     * @return итог опроса
     */
    public <T> OperationOutcome<T> poll(Supplier<OperationStatus<T>> fetchStatus,
                                        PollPolicy policy,
                                        CancellationToken token) {
        Instant startedAt = clock.instant();
        Duration delay = policy.getInitialDelay();
        int attempts = 0;
        int consecutiveFailures = 0;
        RuntimeException lastFailure = null;

        while (true) {
            if (token.isCancelled()) {
                return OperationOutcome.cancelled(attempts);
            }

            attempts++;
            OperationStatus<T> status;
            try {
                status = fetchStatus.get();
                consecutiveFailures = 0;
                lastFailure = null;
            } catch (RuntimeException e) {
                consecutiveFailures++;
                lastFailure = e;
                log.warn("Status request failed (attempt {}, {} consecutive): {}",
                        attempts, consecutiveFailures, e.getMessage());
                if (consecutiveFailures >= policy.getMaxConsecutiveFetchFailures()) {
                    return OperationOutcome.pollingError(e, attempts);
                }
                status = null;
            }

            if (status != null) {
                switch (status.getStage()) {
                    case SUCCEEDED -> {
                        log.debug("Operation succeeded after {} attempts", attempts);
                        return OperationOutcome.succeeded(status.getPayload(), attempts);
                    }
                    case FAILED -> {
                        log.debug("Operation failed after {} attempts: {}", attempts, status.getError());
                        return OperationOutcome.failed(status.getError(), attempts);
                    }
                    case RUNNING -> log.debug("Operation still running (attempt {})", attempts);
                }
            }

            Duration elapsed = Duration.between(startedAt, clock.instant());
            if (attempts >= policy.getMaxAttempts() || elapsed.compareTo(policy.getMaxTotalWait()) >= 0) {
                if (lastFailure != null) {
                    return OperationOutcome.pollingError(lastFailure, attempts);
                }
                return OperationOutcome.timedOut(
                        "Operation still running after " + attempts + " attempts and " + elapsed.toMillis() + " ms",
                        attempts);
            }

            if (token.isCancelled()) {
                return OperationOutcome.cancelled(attempts);
            }

            Duration remaining = policy.getMaxTotalWait().minus(elapsed);
            Duration pause = withJitter(delay, policy.getJitter());
            if (pause.compareTo(remaining) > 0) {
                pause = remaining;
            }
            try {
                sleeper.sleep(pause, token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return OperationOutcome.cancelled(attempts);
            }
            delay = policy.nextDelay(delay);
        }
    }

    private Duration withJitter(Duration delay, double jitter) {
        if (jitter <= 0.0 || delay.isZero()) {
            return delay;
        }
        double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
        return Duration.ofMillis(Math.max(0L, Math.round(delay.toMillis() * factor)));
    }
}
