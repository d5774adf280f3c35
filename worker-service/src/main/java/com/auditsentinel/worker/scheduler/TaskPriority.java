package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Dispatch priority of a task. Declaration order is dispatch order:
 * {@code CRITICAL} tasks leave the queue first.
 *
 * @since 1.0.0
 */
public enum TaskPriority {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /** Priority of tasks submitted without one. */
    public static final TaskPriority DEFAULT = MEDIUM;

    /**
     * @return sort rank, lower is dispatched first
     */
    public int rank() {
        return ordinal();
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a priority label, case-insensitively. A missing label resolves to
     * {@link #DEFAULT}.
     *
     * @param label priority label such as {@code "high"}, or {@code null}
     * @return the matching priority
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static TaskPriority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return DEFAULT;
        }
        return TaskPriority.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
