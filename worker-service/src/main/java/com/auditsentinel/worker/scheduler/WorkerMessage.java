package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Frame sent from a unit to the scheduler, discriminated by {@link Type}.
 *
 * <table>
 * <caption>Fields per type</caption>
 * <tr><th>type</th><th>fields</th></tr>
 * <tr><td>{@code started}</td><td>{@code taskId}</td></tr>
 * <tr><td>{@code progress}</td><td>{@code taskId, percent, message}</td></tr>
 * <tr><td>{@code completed}</td><td>{@code taskId, result}</td></tr>
 * <tr><td>{@code failed}</td><td>{@code taskId, error}</td></tr>
 * <tr><td>{@code ready}</td><td>none</td></tr>
 * </table>
 *
 * <p>
 * Use the static factories; fields that do not apply to a type are
 * {@code null} and omitted from the JSON frame.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class WorkerMessage {

    /**
     * Message discriminator.
     */
    public enum Type {
        STARTED,
        PROGRESS,
        COMPLETED,
        FAILED,
        READY;

        @JsonValue
        public String getLabel() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromLabel(String label) {
            Objects.requireNonNull(label, "Message type must not be null");
            return Type.valueOf(label.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Type type;
    private final String taskId;
    private final Integer percent;
    private final String message;
    private final Map<String, Object> result;
    private final TaskError error;

    @JsonCreator
    public WorkerMessage(@JsonProperty("type") Type type,
            @JsonProperty("taskId") String taskId,
            @JsonProperty("percent") Integer percent,
            @JsonProperty("message") String message,
            @JsonProperty("result") Map<String, Object> result,
            @JsonProperty("error") TaskError error) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.taskId = taskId;
        this.percent = percent;
        this.message = message;
        this.result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : null;
        this.error = error;
        if (type != Type.READY) {
            Objects.requireNonNull(taskId, "taskId must not be null for " + type.getLabel());
        }
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static WorkerMessage started(String taskId) {
        return new WorkerMessage(Type.STARTED, taskId, null, null, null, null);
    }

    public static WorkerMessage progress(String taskId, int percent, String message) {
        return new WorkerMessage(Type.PROGRESS, taskId, percent, message, null, null);
    }

    public static WorkerMessage completed(String taskId, Map<String, Object> result) {
        return new WorkerMessage(Type.COMPLETED, taskId, null, null,
                result != null ? result : Map.of(), null);
    }

    public static WorkerMessage failed(String taskId, TaskError error) {
        return new WorkerMessage(Type.FAILED, taskId, null, null, null,
                Objects.requireNonNull(error, "error must not be null"));
    }

    public static WorkerMessage ready() {
        return new WorkerMessage(Type.READY, null, null, null, null, null);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public Type getType() {
        return type;
    }

    public String getTaskId() {
        return taskId;
    }

    public Integer getPercent() {
        return percent;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public TaskError getError() {
        return error;
    }

    @Override
    public String toString() {
        return "WorkerMessage{type=" + type.getLabel()
                + (taskId != null ? ", taskId='" + taskId + '\'' : "")
                + (percent != null ? ", percent=" + percent : "")
                + '}';
    }
}
