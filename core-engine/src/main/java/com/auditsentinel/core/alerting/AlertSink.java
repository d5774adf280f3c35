package com.auditsentinel.core.alerting;

import com.auditsentinel.core.model.Alert;

/**
 * Destination for alerts raised from high and critical findings.
 *
 * <p>
 * Implementations talk to the alert-management collaborator. A sink is
 * called once per alert; it must be safe to call from the thread running
 * the analysis.
 * </p>
 *
 * @since 1.0.0
 */
public interface AlertSink {

    /**
     * Deliver one alert.
     *
     * @param alert the alert to create
     * @return the collaborator's answer
     * @throws AlertDeliveryException if the alert could not be delivered
     */
    AlertDelivery postAlert(Alert alert) throws AlertDeliveryException;
}
