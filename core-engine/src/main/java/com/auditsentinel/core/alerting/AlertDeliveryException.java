package com.auditsentinel.core.alerting;

/**
 * An alert could not be handed to the alert-management collaborator.
 *
 * @since 1.0.0
 */
public class AlertDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
