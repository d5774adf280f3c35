package com.auditsentinel.worker.store;

import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskError;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence of task state.
 *
 * <p>
 * The submitter registers a task before submitting it; the scheduler then
 * reports progress and the terminal outcome. The three update operations
 * are no-ops when no record exists for the task id, and a record in a
 * terminal state keeps that state.
 * </p>
 *
 * @since 1.0.0
 */
public interface JobStore {

    /**
     * Create the {@code queued} record for a task.
     *
     * @param task the task about to be submitted
     * @return the new record
     * @throws IllegalArgumentException if a record with the same id exists
     */
    TaskRecord register(Task task);

    /**
     * @param taskId  task id
     * @param percent reported progress
     * @param status  status implied by the progress
     */
    void updateProgress(String taskId, int percent, TaskStatus status);

    /**
     * @param taskId task id
     * @param result the result payload
     */
    void markCompleted(String taskId, Map<String, Object> result);

    /**
     * @param taskId task id
     * @param error  error message and detail
     */
    void markFailed(String taskId, TaskError error);

    Optional<TaskRecord> find(String taskId);

    /**
     * Remove terminal records that reached their terminal state before the
     * cutoff.
     *
     * @param cutoff oldest completion time to keep
     * @return number of removed records
     */
    int purgeTerminalBefore(Instant cutoff);
}
