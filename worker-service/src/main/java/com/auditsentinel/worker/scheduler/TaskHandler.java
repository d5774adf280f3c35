package com.auditsentinel.worker.scheduler;

import java.util.Map;

/**
 * Executes tasks of one {@link TaskKind} inside a worker unit.
 *
 * <p>
 * Every unit owns its own handler instances; a handler is only ever called
 * from its unit's thread, one task at a time.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * An {@link Exception} thrown by {@link #handle} fails the task. An
 * {@link Error} terminates the unit; the scheduler replaces it.
 * </p>
 *
 * @since 1.0.0
 */
public interface TaskHandler {

    /**
     * @return the kind of task this handler runs
     */
    TaskKind kind();

    /**
     * Run one task.
     *
     * @param task     the task
     * @param progress progress channel for the task
     * @return the result payload reported with {@code completed}
     * @throws Exception if the task fails
     */
    Map<String, Object> handle(Task task, ProgressReporter progress) throws Exception;
}
