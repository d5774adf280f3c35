package com.auditsentinel.core.alerting;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response of the alert-management collaborator: {@code {success, alert}}.
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AlertDelivery {

    private final boolean success;
    private final Map<String, Object> alert;

    @JsonCreator
    public AlertDelivery(@JsonProperty("success") boolean success,
            @JsonProperty("alert") Map<String, Object> alert) {
        this.success = success;
        this.alert = alert != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(alert))
                : null;
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * @return the stored alert as echoed by the collaborator, or {@code null}
     */
    public Map<String, Object> getAlert() {
        return alert;
    }

    @Override
    public String toString() {
        return "AlertDelivery{success=" + success + ", alert=" + alert + '}';
    }
}
