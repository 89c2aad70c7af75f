package com.example.docextract.service;

import com.example.docextract.config.AppConfig;
import com.example.docextract.model.DocumentTask;
import com.example.docextract.model.ErrorKind;
import com.example.docextract.model.LifecycleState;
import com.example.docextract.model.TaskError;
import com.example.docextract.model.TaskResult;
import com.example.docextract.service.registry.InMemoryStatusRegistry;
import com.example.docextract.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RegistryEvictionSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldEvictTerminalTasksOlderThanRetention() {
        InMemoryStatusRegistry registry = new InMemoryStatusRegistry();
        AppConfig appConfig = new AppConfig();
        appConfig.getRegistry().setRetention(Duration.ofHours(1));
        MutableClock clock = new MutableClock(T0);
        RegistryEvictionScheduler scheduler = new RegistryEvictionScheduler(registry, appConfig, clock);

        registry.put(failed("expired", T0));
        registry.put(failed("recent", T0.plus(Duration.ofMinutes(50))));
        registry.put(running("running", T0));

        clock.advance(Duration.ofMinutes(90));
        scheduler.evictExpired();

        assertTrue(registry.get("expired").isEmpty());
        assertTrue(registry.get("recent").isPresent());
        assertTrue(registry.get("running").isPresent());
    }

    private static DocumentTask running(String id, Instant updatedAt) {
        return DocumentTask.builder()
                .id(id)
                .state(LifecycleState.POLLING)
                .sourceFilename("protocol.pdf")
                .contentType("application/pdf")
                .createdAt(updatedAt)
                .updatedAt(updatedAt)
                .build();
    }

    private static DocumentTask failed(String id, Instant updatedAt) {
        return running(id, updatedAt).toBuilder()
                .state(LifecycleState.FAILED)
                .result(TaskResult.failure(TaskError.of(ErrorKind.TIMED_OUT, "still running")))
                .build();
    }
}
