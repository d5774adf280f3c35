/**
 * Worker pool and priority scheduler.
 *
 * <p>
 * {@link com.auditsentinel.worker.scheduler.TaskScheduler} owns the task
 * queue and the active-task registry and talks to its
 * {@link com.auditsentinel.worker.scheduler.WorkerUnit}s only through
 * JSON frames encoded by
 * {@link com.auditsentinel.worker.scheduler.MessageCodec}.
 * </p>
 */
package com.auditsentinel.worker.scheduler;
