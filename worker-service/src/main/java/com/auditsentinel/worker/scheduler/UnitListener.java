package com.auditsentinel.worker.scheduler;

/**
 * Receiver of everything a {@link WorkerUnit} reports.
 *
 * <p>
 * Called from the unit's own thread; implementations hand the call over to
 * the scheduler thread and return quickly.
 * </p>
 *
 * @since 1.0.0
 */
public interface UnitListener {

    /**
     * @param unit  the reporting unit
     * @param frame an encoded {@link WorkerMessage}
     */
    void onFrame(WorkerUnit unit, String frame);

    /**
     * The unit died without being terminated.
     *
     * @param unit  the unit
     * @param cause what killed it
     */
    void onCrash(WorkerUnit unit, Throwable cause);
}
