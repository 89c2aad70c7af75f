package com.example.docextract.service;

import com.example.docextract.config.AppConfig;
import com.example.docextract.service.registry.StatusRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Периодически удаляет из реестра давно завершённые задачи.
 *
 * Активен только при заданном {@code app.registry.retention}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.registry", name = "retention")
public class RegistryEvictionScheduler {

    private final StatusRegistry statusRegistry;
    private final AppConfig appConfig;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${app.registry.eviction-interval-ms:60000}")
    public void evictExpired() {
        Instant cutoff = Instant.now(clock).minus(appConfig.getRegistry().getRetention());
        int evicted = statusRegistry.evictTerminalOlderThan(cutoff);
        log.debug("Registry eviction pass: {} removed, {} remaining", evicted, statusRegistry.size());
    }
}
