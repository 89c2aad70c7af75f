package com.example.docextract.model;

/**
 * Состояния жизненного цикла документа.
 *
 * Порядок объявления совпадает с порядком прохождения состояний на успешном пути.
 */
public enum LifecycleState {
    QUEUED,
    UPLOADING,
    UPLOADED,
    SUBMITTING,
    SUBMITTED,
    POLLING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Следующее состояние на успешном пути, либо null для терминальных состояний.
     */
    public LifecycleState successor() {
        return switch (this) {
            case QUEUED -> UPLOADING;
            case UPLOADING -> UPLOADED;
            case UPLOADED -> SUBMITTING;
            case SUBMITTING -> SUBMITTED;
            case SUBMITTED -> POLLING;
            case POLLING -> COMPLETED;
            case COMPLETED, FAILED -> null;
        };
    }

    public boolean isAtLeast(LifecycleState other) {
        return compareTo(other) >= 0;
    }
}
