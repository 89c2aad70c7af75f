package com.example.docextract.service.polling;

import com.example.docextract.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class OperationPollerTest {

    private MutableClock clock;
    private List<Duration> sleeps;
    private OperationPoller poller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        sleeps = new ArrayList<>();
        poller = new OperationPoller(clock, (duration, token) -> {
            sleeps.add(duration);
            clock.advance(duration);
        });
    }

    @Test
    void shouldTimeOutAfterExactlyMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        OperationOutcome<String> outcome = poller.poll(() -> {
            calls.incrementAndGet();
            return OperationStatus.running();
        }, policy(3, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.TIMED_OUT, outcome.getType());
        assertEquals(3, outcome.getAttempts());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size());
    }

    @Test
    void shouldReturnPayloadWhenSecondCallSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        OperationOutcome<String> outcome = poller.poll(() -> calls.incrementAndGet() == 1
                ? OperationStatus.running()
                : OperationStatus.succeeded("fields"), policy(10, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.SUCCEEDED, outcome.getType());
        assertEquals("fields", outcome.getPayload());
        assertEquals(2, calls.get());
        assertEquals(1, sleeps.size());
    }

    @Test
    void shouldStopImmediatelyWhenOperationFails() {
        OperationOutcome<String> outcome = poller.poll(
                () -> OperationStatus.failed("Analysis failed: corrupt file"), policy(10, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.FAILED, outcome.getType());
        assertEquals("Analysis failed: corrupt file", outcome.getError());
        assertEquals(1, outcome.getAttempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldReportPollingErrorAfterConsecutiveFetchFailures() {
        IllegalStateException failure = new IllegalStateException("connection reset");

        OperationOutcome<String> outcome = poller.poll(() -> {
            throw failure;
        }, policy(10, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.POLLING_ERROR, outcome.getType());
        assertEquals(3, outcome.getAttempts());
        assertSame(failure, outcome.getCause());
        assertEquals("connection reset", outcome.getError());
    }

    @Test
    void shouldTolerateTransientFetchFailure() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<OperationStatus<String>> fetch = () -> {
            int call = calls.incrementAndGet();
            if (call <= 2) {
                throw new IllegalStateException("HTTP 503");
            }
            return OperationStatus.succeeded("ok");
        };

        OperationOutcome<String> outcome = poller.poll(fetch, policy(10, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.SUCCEEDED, outcome.getType());
        assertEquals(3, outcome.getAttempts());
    }

    @Test
    void shouldReportPollingErrorWhenBudgetEndsOnFailedFetch() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<OperationStatus<String>> fetch = () -> {
            if (calls.incrementAndGet() == 1) {
                return OperationStatus.running();
            }
            throw new IllegalStateException("timeout");
        };

        OperationOutcome<String> outcome = poller.poll(fetch, policy(2, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.POLLING_ERROR, outcome.getType());
        assertEquals(2, outcome.getAttempts());
    }

    @Test
    void shouldTimeOutWhenTotalWaitIsExhausted() {
        PollPolicy policy = PollPolicy.builder()
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(10))
                .backoffMultiplier(1.5)
                .maxTotalWait(Duration.ofMillis(2500))
                .maxAttempts(100)
                .maxConsecutiveFetchFailures(3)
                .build();

        OperationOutcome<String> outcome = poller.poll(OperationStatus::running, policy);

        assertEquals(OperationOutcome.Type.TIMED_OUT, outcome.getType());
        assertEquals(3, outcome.getAttempts());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofMillis(1500)), sleeps);
    }

    @Test
    void shouldGrowDelayUpToMaximum() {
        PollPolicy policy = PollPolicy.builder()
                .initialDelay(Duration.ofSeconds(1))
                .maxDelay(Duration.ofSeconds(3))
                .backoffMultiplier(2.0)
                .maxTotalWait(Duration.ofHours(1))
                .maxAttempts(5)
                .maxConsecutiveFetchFailures(3)
                .build();

        poller.poll(OperationStatus::running, policy);

        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(3), Duration.ofSeconds(3)),
                sleeps);
    }

    @Test
    void zeroInitialDelayShouldStillBackOff() {
        PollPolicy policy = PollPolicy.builder()
                .initialDelay(Duration.ZERO)
                .maxDelay(Duration.ofMillis(8))
                .backoffMultiplier(2.0)
                .maxTotalWait(Duration.ofHours(1))
                .maxAttempts(6)
                .maxConsecutiveFetchFailures(3)
                .build();

        poller.poll(OperationStatus::running, policy);

        assertEquals(List.of(Duration.ZERO, Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofMillis(4),
                Duration.ofMillis(8)), sleeps);
    }

    @Test
    void shouldNotFetchWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger calls = new AtomicInteger();

        OperationOutcome<String> outcome = poller.poll(() -> {
            calls.incrementAndGet();
            return OperationStatus.running();
        }, policy(10, Duration.ofHours(1)), token);

        assertEquals(OperationOutcome.Type.CANCELLED, outcome.getType());
        assertEquals(0, calls.get());
    }

    @Test
    void shouldStopWhenCancelledDuringPause() {
        CancellationToken token = new CancellationToken();
        OperationPoller cancellingPoller = new OperationPoller(clock, (duration, t) -> t.cancel());

        OperationOutcome<String> outcome = cancellingPoller.poll(
                OperationStatus::running, policy(10, Duration.ofHours(1)), token);

        assertEquals(OperationOutcome.Type.CANCELLED, outcome.getType());
        assertEquals(1, outcome.getAttempts());
    }

    @Test
    void shouldTreatInterruptAsCancellation() {
        OperationPoller interruptedPoller = new OperationPoller(clock, (duration, token) -> {
            throw new InterruptedException("shutdown");
        });

        OperationOutcome<String> outcome = interruptedPoller.poll(
                OperationStatus::running, policy(10, Duration.ofHours(1)));

        assertEquals(OperationOutcome.Type.CANCELLED, outcome.getType());
        assertTrue(Thread.interrupted());
    }

    @Test
    void cancellableSleeperShouldWakeUpOnCancel() throws Exception {
        CancellationToken token = new CancellationToken();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        });
        canceller.start();

        long started = System.nanoTime();
        Sleeper.cancellable().sleep(Duration.ofSeconds(30), token);

        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(10)) < 0);
        canceller.join();
    }

    @Test
    void policyShouldRejectInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> policy(0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class, () -> PollPolicy.builder()
                .initialDelay(Duration.ofSeconds(5))
                .maxDelay(Duration.ofSeconds(1))
                .backoffMultiplier(1.5)
                .maxTotalWait(Duration.ofMinutes(1))
                .maxAttempts(3)
                .maxConsecutiveFetchFailures(1)
                .build());
    }

    private static PollPolicy policy(int maxAttempts, Duration maxTotalWait) {
        return PollPolicy.builder()
                .initialDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofSeconds(1))
                .backoffMultiplier(1.5)
                .maxTotalWait(maxTotalWait)
                .maxAttempts(maxAttempts)
                .maxConsecutiveFetchFailures(3)
                .build();
    }
}
