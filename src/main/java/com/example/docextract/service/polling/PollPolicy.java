package com.example.docextract.service.polling;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Параметры опроса: экспоненциальная задержка и ограничения по времени и числу попыток.
 * Опрос завершается по первому сработавшему ограничению.
 */
@Value
public class PollPolicy {
    Duration initialDelay;
    Duration maxDelay;
    double backoffMultiplier;
    Duration maxTotalWait;
    int maxAttempts;
    int maxConsecutiveFetchFailures;

    /**
     * Доля случайного разброса задержки (0 - без разброса)
     */
    double jitter;

    @Builder
    public PollPolicy(Duration initialDelay,
                      Duration maxDelay,
                      double backoffMultiplier,
                      Duration maxTotalWait,
                      int maxAttempts,
                      int maxConsecutiveFetchFailures,
                      double jitter) {
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be non-negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1");
        }
        if (maxTotalWait == null || maxTotalWait.isNegative()) {
            throw new IllegalArgumentException("maxTotalWait must be non-negative");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxConsecutiveFetchFailures < 1) {
            throw new IllegalArgumentException("maxConsecutiveFetchFailures must be >= 1");
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("jitter must be within [0, 1]");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.backoffMultiplier = backoffMultiplier;
        this.maxTotalWait = maxTotalWait;
        this.maxAttempts = maxAttempts;
        this.maxConsecutiveFetchFailures = maxConsecutiveFetchFailures;
        this.jitter = jitter;
    }

    /**
     * Задержка, следующая за текущей: не меньше 1 мс и не больше {@code maxDelay}.
     */
    Duration nextDelay(Duration current) {
        long nextMillis = Math.max(1L, (long) Math.ceil(current.toMillis() * backoffMultiplier));
        return nextMillis >= maxDelay.toMillis() ? maxDelay : Duration.ofMillis(nextMillis);
    }
}
