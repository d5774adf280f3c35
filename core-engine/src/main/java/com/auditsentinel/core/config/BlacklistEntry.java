package com.auditsentinel.core.config;

import java.util.Objects;

/**
 * One denylisted value with the reason it was listed.
 *
 * @since 1.0.0
 */
public final class BlacklistEntry {

    private final String value;
    private final String reason;

    public BlacklistEntry(String value, String reason) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.reason = reason;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the listed reason, or {@code null} when the CSV gives none
     */
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BlacklistEntry that))
            return false;
        return value.equals(that.value) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason);
    }

    @Override
    public String toString() {
        return value;
    }
}
