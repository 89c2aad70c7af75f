package com.example.docextract.service.registry;

import com.example.docextract.model.DocumentTask;

import java.time.Instant;
import java.util.Optional;

/**
 * Реестр последних известных снимков задач.
 *
 * Реализации потокобезопасны; чтение не блокируется записью.
 */
public interface StatusRegistry {

    /**
     * Сохраняет снимок. Снимок с более ранним updatedAt, чем уже сохранённый, игнорируется.
     */
    void put(DocumentTask task);

    Optional<DocumentTask> get(String id);

    boolean delete(String id);

    int size();

    /**
     * Удаляет терминальные задачи, обновлённые раньше указанного момента.
     *
     * @return количество удалённых задач
     */
    int evictTerminalOlderThan(Instant cutoff);
}
