package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Error reported for a failed task: a human-readable message and a detail
 * string, usually the stack trace.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskError {

    private final String message;
    private final String detail;

    @JsonCreator
    public TaskError(@JsonProperty("message") String message,
            @JsonProperty("detail") String detail) {
        this.message = message != null ? message : "Unknown error";
        this.detail = detail;
    }

    /**
     * @param cause the failure
     * @return an error carrying the cause's message and stack trace
     */
    public static TaskError of(Throwable cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        return new TaskError(message, trace.toString());
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaskError that)) {
            return false;
        }
        return message.equals(that.message) && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, detail);
    }

    @Override
    public String toString() {
        return "TaskError{message='" + message + "'}";
    }
}
