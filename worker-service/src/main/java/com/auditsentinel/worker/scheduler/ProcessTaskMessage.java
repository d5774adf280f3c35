package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Frame sent from the scheduler to a unit:
 * {@code {"type":"process_task","task":{...}}}.
 *
 * @since 1.0.0
 */
public final class ProcessTaskMessage {

    public static final String TYPE = "process_task";

    private final Task task;

    @JsonCreator
    public ProcessTaskMessage(@JsonProperty("task") Task task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
    }

    @JsonProperty("type")
    public String getType() {
        return TYPE;
    }

    public Task getTask() {
        return task;
    }
}
