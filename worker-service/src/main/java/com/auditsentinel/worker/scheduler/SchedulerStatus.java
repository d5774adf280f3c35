package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time snapshot of the scheduler.
 *
 * @since 1.0.0
 */
public final class SchedulerStatus {

    private final int workers;
    private final int activeWorkers;
    private final int queueLength;
    private final List<String> activeTasks;
    private final List<String> queuedTasks;
    private final boolean processing;

    public SchedulerStatus(int workers,
            int activeWorkers,
            int queueLength,
            List<String> activeTasks,
            List<String> queuedTasks,
            boolean processing) {
        this.workers = workers;
        this.activeWorkers = activeWorkers;
        this.queueLength = queueLength;
        this.activeTasks = List.copyOf(Objects.requireNonNull(activeTasks, "activeTasks must not be null"));
        this.queuedTasks = List.copyOf(Objects.requireNonNull(queuedTasks, "queuedTasks must not be null"));
        this.processing = processing;
    }

    /**
     * @return snapshot of a scheduler that has been shut down
     */
    public static SchedulerStatus stopped() {
        return new SchedulerStatus(0, 0, 0, List.of(), List.of(), false);
    }

    /** Number of live units in the pool. */
    public int getWorkers() {
        return workers;
    }

    /** Number of units with an entry in the active-task registry. */
    public int getActiveWorkers() {
        return activeWorkers;
    }

    public int getQueueLength() {
        return queueLength;
    }

    /** Ids of tasks in the active-task registry, by slot. */
    public List<String> getActiveTasks() {
        return activeTasks;
    }

    /** Ids of queued tasks, in dispatch order. */
    public List<String> getQueuedTasks() {
        return queuedTasks;
    }

    /** Whether the dispatch loop is running or waiting to retry. */
    @JsonProperty("isProcessing")
    public boolean isProcessing() {
        return processing;
    }

    @Override
    public String toString() {
        return "SchedulerStatus{workers=" + workers +
                ", activeWorkers=" + activeWorkers +
                ", queueLength=" + queueLength +
                ", activeTasks=" + activeTasks +
                ", isProcessing=" + processing +
                '}';
    }
}
