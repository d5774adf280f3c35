package com.auditsentinel.worker.scheduler;

/**
 * Creates the unit for a pool slot, both at start-up and when a crashed
 * unit is replaced.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface WorkerUnitFactory {

    /**
     * @param slot     slot index the unit occupies
     * @param listener receiver of the unit's frames
     * @return a new, not yet started unit
     */
    WorkerUnit create(int slot, UnitListener listener);
}
