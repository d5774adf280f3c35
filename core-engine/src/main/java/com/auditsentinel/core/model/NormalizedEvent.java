package com.auditsentinel.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical view of one raw audit record.
 *
 * <p>
 * Produced by the event normalizer; immutable. Text attributes that the
 * record does not carry hold the {@link #UNKNOWN} sentinel, never
 * {@code null}. The timestamp is the only optional attribute: records
 * without a parseable time have none.
 * </p>
 *
 * @since 1.0.0
 */
public final class NormalizedEvent {

    /** Sentinel for attributes the record does not provide. */
    public static final String UNKNOWN = "Unknown";

    private final String id;
    private final Instant timestamp;
    private final Identity identity;
    private final String operation;
    private final String result;
    private final String ipAddress;
    private final String userAgent;
    private final String application;
    private final String location;
    private final String category;
    private final List<Object> targetResources;
    private final List<Object> additionalDetails;
    private final AuditRecord rawEvent;

    private NormalizedEvent(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.timestamp = b.timestamp;
        this.identity = Objects.requireNonNull(b.identity, "identity must not be null");
        this.operation = orUnknown(b.operation);
        this.result = orUnknown(b.result);
        this.ipAddress = orUnknown(b.ipAddress);
        this.userAgent = orUnknown(b.userAgent);
        this.application = orUnknown(b.application);
        this.location = orUnknown(b.location);
        this.category = orUnknown(b.category);
        this.targetResources = b.targetResources != null ? List.copyOf(b.targetResources) : List.of();
        this.additionalDetails = b.additionalDetails != null ? List.copyOf(b.additionalDetails) : List.of();
        this.rawEvent = Objects.requireNonNull(b.rawEvent, "rawEvent must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public Optional<Instant> getTimestamp() {
        return Optional.ofNullable(timestamp);
    }

    public Identity getIdentity() {
        return identity;
    }

    /**
     * @return rendered user identity; never empty
     */
    public String getUser() {
        return identity.render();
    }

    public boolean isUnknownUser() {
        return identity.isSynthetic();
    }

    public String getOperation() {
        return operation;
    }

    public String getResult() {
        return result;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getApplication() {
        return application;
    }

    public String getLocation() {
        return location;
    }

    public String getCategory() {
        return category;
    }

    public List<Object> getTargetResources() {
        return targetResources;
    }

    public List<Object> getAdditionalDetails() {
        return additionalDetails;
    }

    public AuditRecord getRawEvent() {
        return rawEvent;
    }

    /**
     * @return {@code true} if the result is {@code success} or {@code succeeded}
     */
    public boolean isSuccess() {
        String r = result.toLowerCase(Locale.ROOT);
        return r.equals("success") || r.equals("succeeded");
    }

    /**
     * @return {@code true} if the result is {@code failure} or {@code failed}
     */
    public boolean isFailure() {
        String r = result.toLowerCase(Locale.ROOT);
        return r.equals("failure") || r.equals("failed");
    }

    /**
     * @param value attribute value
     * @return {@code true} if the value is the unknown sentinel
     */
    public static boolean isUnknown(String value) {
        return value == null || UNKNOWN.equals(value);
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String id;
        private Instant timestamp;
        private Identity identity;
        private String operation;
        private String result;
        private String ipAddress;
        private String userAgent;
        private String application;
        private String location;
        private String category;
        private List<Object> targetResources;
        private List<Object> additionalDetails;
        private AuditRecord rawEvent;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder identity(Identity identity) {
            this.identity = identity;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder ipAddress(String ipAddress) {
            this.ipAddress = ipAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder application(String application) {
            this.application = application;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder targetResources(List<Object> targetResources) {
            this.targetResources = targetResources;
            return this;
        }

        public Builder additionalDetails(List<Object> additionalDetails) {
            this.additionalDetails = additionalDetails;
            return this;
        }

        public Builder rawEvent(AuditRecord rawEvent) {
            this.rawEvent = rawEvent;
            return this;
        }

        /**
         * @return a new {@link NormalizedEvent}
         * @throws NullPointerException if {@code id}, {@code identity} or
         *                              {@code rawEvent} is missing
         */
        public NormalizedEvent build() {
            return new NormalizedEvent(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NormalizedEvent that))
            return false;
        return id.equals(that.id)
                && Objects.equals(timestamp, that.timestamp)
                && identity.equals(that.identity)
                && operation.equals(that.operation)
                && result.equals(that.result)
                && ipAddress.equals(that.ipAddress)
                && userAgent.equals(that.userAgent)
                && application.equals(that.application)
                && location.equals(that.location)
                && category.equals(that.category)
                && targetResources.equals(that.targetResources)
                && additionalDetails.equals(that.additionalDetails)
                && rawEvent.equals(that.rawEvent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, timestamp, identity, operation, result, ipAddress);
    }

    @Override
    public String toString() {
        return "NormalizedEvent{" +
                "id='" + id + '\'' +
                ", timestamp=" + timestamp +
                ", user='" + getUser() + '\'' +
                ", operation='" + operation + '\'' +
                ", result='" + result + '\'' +
                ", ipAddress='" + ipAddress + '\'' +
                '}';
    }
}
