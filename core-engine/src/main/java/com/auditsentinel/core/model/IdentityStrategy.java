package com.auditsentinel.core.model;

/**
 * How a normalized user identity was obtained.
 *
 * <p>
 * Declared in fallback order: an explicit user field wins, then the session
 * id, the client IP address, the application and finally the timestamp plus
 * a content hash. Every strategy except {@link #REAL} yields a synthetic
 * identity whose rendered form starts with a recognizable prefix.
 * </p>
 *
 * @since 1.0.0
 */
public enum IdentityStrategy {

    REAL(""),
    SESSION("Unknown_Session_"),
    IP_ADDRESS("Unknown_IP_"),
    APPLICATION("Unknown_App_"),
    TIMESTAMP("Unknown_");

    private final String prefix;

    IdentityStrategy(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean isSynthetic() {
        return this != REAL;
    }
}
