package com.example.docextract.service.registry;

import com.example.docextract.model.DocumentTask;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Хранилище статусов задач в памяти процесса.
 *
 * Содержимое не переживает перезапуск.
 */
@Slf4j
@Component
public class InMemoryStatusRegistry implements StatusRegistry {
    private final Map<String, DocumentTask> tasks = new ConcurrentHashMap<>();

    @Override
    public void put(DocumentTask task) {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(task.getId(), "task id must not be null");
        tasks.merge(task.getId(), task, InMemoryStatusRegistry::latest);
    }

    @Override
    public Optional<DocumentTask> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public boolean delete(String id) {
        return id != null && tasks.remove(id) != null;
    }

    @Override
    public int size() {
        return tasks.size();
    }

    @Override
    public int evictTerminalOlderThan(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        tasks.forEach((id, task) -> {
            if (task.isTerminal() && task.getUpdatedAt().isBefore(cutoff) && tasks.remove(id, task)) {
                evicted.incrementAndGet();
            }
        });
        if (evicted.get() > 0) {
            log.info("Evicted {} terminal tasks updated before {}", evicted.get(), cutoff);
        }
        return evicted.get();
    }

    // last-write-wins по updatedAt; при равенстве побеждает более поздняя запись.
    // Терминальный снимок больше не перезаписывается.
    private static DocumentTask latest(DocumentTask current, DocumentTask candidate) {
        if (current.isTerminal()) {
            return current;
        }
        if (current.getUpdatedAt() != null && candidate.getUpdatedAt() != null
                && candidate.getUpdatedAt().isBefore(current.getUpdatedAt())) {
            return current;
        }
        return candidate;
    }
}
