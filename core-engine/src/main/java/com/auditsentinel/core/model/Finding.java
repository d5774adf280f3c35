package com.auditsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One detected security-relevant condition.
 *
 * <p>
 * Findings are immutable: once appended to a run they are never changed.
 * The {@code id} is assigned by the analysis context ({@code finding_1},
 * {@code finding_2}, ...) in detection order.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code type}, {@code severity} and
 * {@code title} are required; omitting any of them throws a
 * {@link NullPointerException} at build time. The {@code timestamp} is
 * absent for findings raised from events that carried no time.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Finding {

    private final String id;
    private final String title;
    private final Severity severity;
    private final String description;
    private final Instant timestamp;
    private final String source;
    private final String type;
    private final String category;
    private final AffectedEntities affectedEntities;
    private final Map<String, Object> evidence;
    private final MitreMapping mitreMapping;
    private final List<String> recommendations;

    private Finding(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.title = Objects.requireNonNull(b.title, "title must not be null");
        this.description = b.description;
        this.timestamp = b.timestamp;
        this.source = b.source;
        this.category = b.category;
        this.affectedEntities = b.affectedEntities != null
                ? b.affectedEntities
                : AffectedEntities.builder().build();
        this.evidence = Collections.unmodifiableMap(new LinkedHashMap<>(b.evidence));
        this.mitreMapping = b.mitreMapping;
        this.recommendations = b.recommendations != null ? List.copyOf(b.recommendations) : List.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getSource() {
        return source;
    }

    public String getType() {
        return type;
    }

    public String getCategory() {
        return category;
    }

    public AffectedEntities getAffectedEntities() {
        return affectedEntities;
    }

    public Map<String, Object> getEvidence() {
        return evidence;
    }

    @JsonProperty("mitreAttack")
    public MitreMapping getMitreMapping() {
        return mitreMapping;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String id;
        private String title;
        private Severity severity;
        private String description;
        private Instant timestamp;
        private String source;
        private String type;
        private String category;
        private AffectedEntities affectedEntities;
        private final Map<String, Object> evidence = new LinkedHashMap<>();
        private MitreMapping mitreMapping;
        private List<String> recommendations;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder affectedEntities(AffectedEntities affectedEntities) {
            this.affectedEntities = affectedEntities;
            return this;
        }

        public Builder evidence(String key, Object value) {
            this.evidence.put(key, value);
            return this;
        }

        public Builder mitreMapping(MitreMapping mitreMapping) {
            this.mitreMapping = mitreMapping;
            return this;
        }

        public Builder recommendations(List<String> recommendations) {
            this.recommendations = recommendations;
            return this;
        }

        public Finding build() {
            return new Finding(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Finding that))
            return false;
        return id.equals(that.id)
                && type.equals(that.type)
                && severity == that.severity
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, severity, timestamp);
    }

    @Override
    public String toString() {
        return "Finding{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                '}';
    }
}
