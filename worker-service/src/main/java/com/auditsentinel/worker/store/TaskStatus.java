package com.auditsentinel.worker.store;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Persisted state of a task. {@code COMPLETED} and {@code FAILED} are
 * terminal; a record never leaves them.
 *
 * @since 1.0.0
 */
public enum TaskStatus {

    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * @param percent reported progress
     * @return {@code COMPLETED} at 100 % and above, {@code RUNNING} otherwise
     */
    public static TaskStatus forProgress(int percent) {
        return percent >= 100 ? COMPLETED : RUNNING;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }
}
