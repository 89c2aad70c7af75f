package com.example.docextract.service;

/**
 * Режим выполнения конвейера.
 */
public enum ExecutionMode {
    /**
     * Вызывающий поток ждёт терминального состояния
     */
    BLOCKING,

    /**
     * Конвейер выполняется в пуле, вызывающий получает задачу в QUEUED
     */
    DETACHED
}
