package com.auditsentinel.worker.scheduler;

/**
 * Channel a {@link TaskHandler} uses to report how far it got.
 *
 * <p>
 * Handlers report non-decreasing percentages for one task. The scheduler
 * forwards them to the job store without checking the order.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ProgressReporter {

    /**
     * @param percent progress in {@code [0, 100]}
     * @param message short description of the current stage
     */
    void report(int percent, String message);
}
