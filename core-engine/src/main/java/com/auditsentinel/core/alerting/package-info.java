/**
 * Alert generation for high and critical findings.
 *
 * <p>
 * The {@link com.auditsentinel.core.alerting.AlertEmitter} is transport
 * agnostic; the HTTP implementation of
 * {@link com.auditsentinel.core.alerting.AlertSink} lives in the worker
 * service.
 * </p>
 */
package com.auditsentinel.core.alerting;
