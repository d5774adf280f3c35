package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Finding severity with its risk-score weight.
 *
 * <p>
 * Serialized as the lowercase label ({@code "high"}), matching the format
 * the alerting API expects.
 * </p>
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW(1),
    MEDIUM(2),
    HIGH(5),
    CRITICAL(10);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    /**
     * @return contribution of one finding of this severity to the risk score
     */
    public int getWeight() {
        return weight;
    }

    /**
     * @return {@code true} for severities that produce an alert
     */
    public boolean isAlertable() {
        return this == HIGH || this == CRITICAL;
    }

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a severity label, case-insensitively.
     *
     * @param label severity label such as {@code "critical"}
     * @return the matching severity
     * @throws IllegalArgumentException if the label is unknown
     */
    @JsonCreator
    public static Severity fromLabel(String label) {
        Objects.requireNonNull(label, "Severity label must not be null");
        return Severity.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
