package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Kind of work a {@link Task} carries. Each unit routes a task to the
 * {@link TaskHandler} registered for its kind.
 *
 * @since 1.0.0
 */
public enum TaskKind {

    ANALYSIS,
    EXTRACTION;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param label kind label such as {@code "analysis"}
     * @return the matching kind
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static TaskKind fromLabel(String label) {
        Objects.requireNonNull(label, "Task kind must not be null");
        return TaskKind.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
