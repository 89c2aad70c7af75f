package com.example.docextract.model;

/**
 * Тип ошибки, с которой задача перешла в FAILED.
 */
public enum ErrorKind {
    /**
     * Не удалось загрузить файл в хранилище
     */
    STORAGE_ERROR,

    /**
     * Сервис анализа отклонил постановку операции
     */
    SUBMISSION_ERROR,

    /**
     * Исчерпаны повторы запроса статуса операции
     */
    POLLING_ERROR,

    /**
     * Сервис анализа сообщил о неуспешном завершении операции
     */
    ANALYSIS_FAILED,

    /**
     * Операция не завершилась за отведённое время
     */
    TIMED_OUT,

    /**
     * Задача отменена вызывающей стороной
     */
    CANCELLED,

    /**
     * Нарушение контракта жизненного цикла (дефект в коде)
     */
    INVALID_TRANSITION,

    /**
     * Пул исполнителей отказался принять задачу
     */
    REJECTED
}
