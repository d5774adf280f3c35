package com.auditsentinel.core.model;

import java.util.Objects;

/**
 * One entry of the finding-type histogram.
 *
 * @since 1.0.0
 */
public final class TopThreat {

    private final String type;
    private final int count;

    public TopThreat(String type, int count) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.count = count;
    }

    public String getType() {
        return type;
    }

    public int getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TopThreat that))
            return false;
        return count == that.count && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, count);
    }

    @Override
    public String toString() {
        return type + "=" + count;
    }
}
