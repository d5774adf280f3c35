package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * User identity of a normalized event: either a real principal name or a
 * synthetic identity derived from another attribute of the record.
 *
 * <p>
 * The strategy travels with the value, so statistics can break unknown users
 * down by strategy without parsing the rendered string. Two identities are
 * equal only if both strategy and seed match; a real user literally named
 * {@code Unknown_IP_10.0.0.1} is never conflated with the synthetic one.
 * </p>
 *
 * @since 1.0.0
 */
public final class Identity {

    private final IdentityStrategy strategy;
    private final String seed;

    private Identity(IdentityStrategy strategy, String seed) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.seed = Objects.requireNonNull(seed, "seed must not be null");
        if (seed.isBlank()) {
            throw new IllegalArgumentException("Identity seed must not be blank");
        }
    }

    /**
     * @param principal user principal or display name from the record
     * @return a real identity
     */
    public static Identity real(String principal) {
        return new Identity(IdentityStrategy.REAL, principal);
    }

    /**
     * @param strategy any synthetic strategy
     * @param seed     attribute value the identity is derived from
     * @return a synthetic identity
     * @throws IllegalArgumentException if {@code strategy} is {@link IdentityStrategy#REAL}
     */
    public static Identity synthetic(IdentityStrategy strategy, String seed) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (!strategy.isSynthetic()) {
            throw new IllegalArgumentException("Synthetic identity requires a synthetic strategy");
        }
        return new Identity(strategy, seed);
    }

    public IdentityStrategy getStrategy() {
        return strategy;
    }

    public String getSeed() {
        return seed;
    }

    public boolean isSynthetic() {
        return strategy.isSynthetic();
    }

    /**
     * @return the display form, e.g. {@code alice@contoso.com} or
     *         {@code Unknown_Session_3f2a...}
     */
    @JsonValue
    public String render() {
        return strategy.getPrefix() + seed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Identity that))
            return false;
        return strategy == that.strategy && seed.equals(that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, seed);
    }

    @Override
    public String toString() {
        return render();
    }
}
