package com.auditsentinel.worker.scheduler;

import java.util.Locale;
import java.util.Objects;

/**
 * What the scheduler does with the task a unit was running when the unit
 * terminated without reporting the task's outcome.
 *
 * @since 1.0.0
 */
public enum OrphanPolicy {

    /**
     * Mark the task failed and free the slot for the replacement unit.
     */
    FAIL,

    /**
     * Leave the task registered against the slot. The task never reaches a
     * terminal state and the slot is not dispatched to again.
     */
    ABANDON;

    /**
     * @param value policy name, case-insensitive
     * @return the matching policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static OrphanPolicy fromString(String value) {
        Objects.requireNonNull(value, "Orphan policy must not be null");
        return OrphanPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
