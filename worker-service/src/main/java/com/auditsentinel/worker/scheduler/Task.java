package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One unit of schedulable work.
 *
 * <p>
 * A task is immutable. The {@code payload} is opaque to the scheduler and
 * only interpreted by the {@link TaskHandler} for the task's {@link TaskKind};
 * an analysis task, for example, carries {@code analysisId},
 * {@code extractionId} and {@code organizationId}.
 * </p>
 *
 * <h3>Identity</h3>
 * <p>
 * The {@code id} must be unique for the lifetime of the process. When the
 * submitter leaves it blank the builder derives one from the kind, the
 * creation time and a random suffix.
 * </p>
 *
 * @since 1.0.0
 */
public final class Task {

    private final String id;
    private final TaskKind kind;
    private final Map<String, Object> payload;
    private final TaskPriority priority;
    private final Instant createdAt;

    @JsonCreator
    public Task(@JsonProperty("id") String id,
            @JsonProperty("kind") TaskKind kind,
            @JsonProperty("payload") Map<String, Object> payload,
            @JsonProperty("priority") TaskPriority priority,
            @JsonProperty("createdAt") Instant createdAt) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.id = id != null && !id.isBlank() ? id : generateId(kind, this.createdAt);
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
        this.priority = priority != null ? priority : TaskPriority.DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public TaskKind getKind() {
        return kind;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @param key payload key
     * @return the payload value as a non-blank string, if present
     */
    public Optional<String> payloadString(String key) {
        Object value = payload.get(key);
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.toString());
    }

    private static String generateId(TaskKind kind, Instant createdAt) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return kind.getLabel() + "_" + createdAt.toEpochMilli() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Task task)) {
            return false;
        }
        return id.equals(task.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', kind=" + kind + ", priority=" + priority + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private String id;
        private TaskKind kind;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private TaskPriority priority;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder payload(Map<String, ?> payload) {
            this.payload.putAll(payload);
            return this;
        }

        public Builder put(String key, Object value) {
            this.payload.put(key, value);
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Task build() {
            return new Task(id, kind, payload, priority, createdAt);
        }
    }
}
