package com.example.docextract.service.polling;

/**
 * Стадия внешней длительной операции.
 */
public enum OperationStage {
    RUNNING,
    SUCCEEDED,
    FAILED
}
