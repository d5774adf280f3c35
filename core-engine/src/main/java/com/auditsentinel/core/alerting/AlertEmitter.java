package com.auditsentinel.core.alerting;

import com.auditsentinel.core.model.Alert;
import com.auditsentinel.core.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the high and critical findings of a run into alerts and delivers
 * them through an {@link AlertSink}.
 *
 * <p>
 * Findings are processed in order. A failed delivery is logged and does
 * not stop the remaining alerts or the analysis.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(AlertEmitter.class);

    private final AlertSink sink;

    public AlertEmitter(AlertSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    /**
     * @param findings all findings of the run
     * @param context  identifiers for the alerts
     * @return the alerts the collaborator confirmed, in finding order
     */
    public List<Map<String, Object>> emit(List<Finding> findings, AlertContext context) {
        Objects.requireNonNull(findings, "findings must not be null");
        Objects.requireNonNull(context, "context must not be null");

        List<Map<String, Object>> created = new ArrayList<>();
        int attempted = 0;
        for (Finding finding : findings) {
            if (!finding.getSeverity().isAlertable()) {
                continue;
            }
            attempted++;
            Alert alert = Alert.fromFinding(finding, context.getOrganizationId(),
                    context.getAnalysisId(), context.getExtractionId());
            try {
                AlertDelivery delivery = sink.postAlert(alert);
                if (delivery.isSuccess() && delivery.getAlert() != null) {
                    created.add(delivery.getAlert());
                } else {
                    LOG.warn("Alert for finding {} was not accepted: {}", finding.getId(), delivery);
                }
            } catch (AlertDeliveryException e) {
                LOG.error("Failed to create alert for finding {}: {}", finding.getId(), e.getMessage(), e);
            }
        }
        LOG.info("Created {}/{} alert(s) for analysis {}", created.size(), attempted, context.getAnalysisId());
        return created;
    }
}
