package com.auditsentinel.worker.scheduler;

/**
 * Isolated execution context that runs tasks one at a time.
 *
 * <p>
 * A unit talks to the scheduler only through its {@link UnitListener}:
 * it posts a {@code ready} frame once initialized, then {@code started},
 * {@code progress} and {@code completed} or {@code failed} frames for each
 * task it receives through {@link #send(Task)}.
 * </p>
 *
 * @since 1.0.0
 */
public interface WorkerUnit {

    /**
     * @return the logical slot index this unit occupies in the pool
     */
    int getSlot();

    /**
     * Start the unit. It posts {@code ready} when it can accept a task.
     */
    void start();

    /**
     * Hand a task to the unit.
     *
     * @param task the task to run
     * @throws TaskDeliveryException if the unit cannot accept the task
     */
    void send(Task task) throws TaskDeliveryException;

    /**
     * Stop the unit. Whatever it is running is abandoned; no further frames
     * are posted.
     */
    void terminate();

    /**
     * @return {@code true} while the unit is started and not terminated
     */
    boolean isAlive();
}
