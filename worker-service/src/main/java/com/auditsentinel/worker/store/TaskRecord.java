package com.auditsentinel.worker.store;

import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskError;
import com.auditsentinel.worker.scheduler.TaskKind;
import com.auditsentinel.worker.scheduler.TaskPriority;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the stored state of one task. Updates produce a new
 * record.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskRecord {

    private final String taskId;
    private final TaskKind kind;
    private final TaskPriority priority;
    private final TaskStatus status;
    private final int progress;
    private final Map<String, Object> result;
    private final String errorMessage;
    private final String errorDetail;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;

    private TaskRecord(String taskId, TaskKind kind, TaskPriority priority, TaskStatus status, int progress,
            Map<String, Object> result, String errorMessage, String errorDetail,
            Instant createdAt, Instant updatedAt, Instant completedAt) {
        this.taskId = Objects.requireNonNull(taskId, "taskId must not be null");
        this.kind = kind;
        this.priority = priority;
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.progress = progress;
        this.result = result != null ? Collections.unmodifiableMap(new LinkedHashMap<>(result)) : null;
        this.errorMessage = errorMessage;
        this.errorDetail = errorDetail;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.completedAt = completedAt;
    }

    /**
     * @param task the submitted task
     * @param now  registration time
     * @return a {@code QUEUED} record at 0 %
     */
    public static TaskRecord queued(Task task, Instant now) {
        Objects.requireNonNull(task, "task must not be null");
        return new TaskRecord(task.getId(), task.getKind(), task.getPriority(), TaskStatus.QUEUED, 0,
                null, null, null, now, now, null);
    }

    TaskRecord withProgress(int percent, TaskStatus newStatus, Instant now) {
        return new TaskRecord(taskId, kind, priority, newStatus, percent, result, errorMessage, errorDetail,
                createdAt, now, newStatus.isTerminal() ? now : completedAt);
    }

    TaskRecord completed(Map<String, Object> newResult, Instant now) {
        return new TaskRecord(taskId, kind, priority, TaskStatus.COMPLETED, 100, newResult, null, null,
                createdAt, now, now);
    }

    TaskRecord failed(TaskError error, Instant now) {
        return new TaskRecord(taskId, kind, priority, TaskStatus.FAILED, progress, null,
                error.getMessage(), error.getDetail(), createdAt, now, now);
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskKind getKind() {
        return kind;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public int getProgress() {
        return progress;
    }

    public Map<String, Object> getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "TaskRecord{taskId='" + taskId + "', status=" + status + ", progress=" + progress + '}';
    }
}
