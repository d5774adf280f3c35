package com.auditsentinel.worker.scheduler;

/**
 * Raised when a task cannot be handed to a worker unit. The scheduler puts
 * the task back at the head of the queue and retries.
 *
 * @since 1.0.0
 */
public class TaskDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public TaskDeliveryException(String message) {
        super(message);
    }

    public TaskDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
