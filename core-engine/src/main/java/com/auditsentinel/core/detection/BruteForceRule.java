package com.auditsentinel.core.detection;

import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Sliding-window brute-force detector.
 *
 * <h3>Algorithm</h3>
 * <p>
 * For every failed event with a timestamp, count the failed events of the
 * same identity among the trailing window kept by the
 * {@link AnalysisContext} whose timestamps lie strictly within
 * {@code windowMinutes} of it, plus the event itself. A count strictly
 * greater than {@code failureThreshold} raises a high-severity finding.
 * </p>
 *
 * <p>
 * Once the threshold is crossed, every further failure inside the window
 * raises another finding.
 * </p>
 *
 * @since 1.0.0
 */
public class BruteForceRule implements DetectionRule {

    private static final Logger LOG = LoggerFactory.getLogger(BruteForceRule.class);

    public static final String RULE_NAME = "brute-force";
    public static final String TYPE = "brute_force";

    private final int failureThreshold;
    private final Duration window;

    public BruteForceRule(AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.failureThreshold = config.getBruteForce().getFailureThreshold();
        this.window = Duration.ofMinutes(config.getBruteForce().getWindowMinutes());
    }

    @Override
    public void evaluate(NormalizedEvent event, AnalysisContext context) {
        Objects.requireNonNull(event, "event must not be null");
        Optional<Instant> timestamp = event.getTimestamp();
        if (!event.isFailure() || timestamp.isEmpty()) {
            return;
        }

        int failures = 1;
        for (NormalizedEvent previous : context.getRecentEvents()) {
            if (previous.isFailure()
                    && previous.getIdentity().equals(event.getIdentity())
                    && previous.getTimestamp().map(t -> withinWindow(t, timestamp.get())).orElse(false)) {
                failures++;
            }
        }

        if (failures <= failureThreshold) {
            LOG.trace("Rule [{}]: {} failure(s) for {} - below threshold", RULE_NAME, failures, event.getUser());
            return;
        }

        context.report(Finding.builder()
                .type(TYPE)
                .severity(Severity.HIGH)
                .category("security")
                .title("Potential Brute Force Attack")
                .description("User " + event.getUser() + " has " + failures + " failed attempts in the last hour")
                .timestamp(timestamp.get())
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .ipAddress(event.getIpAddress())
                        .userAgent(event.getUserAgent())
                        .build())
                .evidence("failureCount", failures)
                .evidence("timeWindow", formatWindow())
                .evidence("ipAddress", event.getIpAddress())
                .evidence("userAgent", event.getUserAgent())
                .mitreMapping(MitreCatalog.mappingFor(TYPE))
                .recommendations(MitreCatalog.recommendationsFor(TYPE)));
    }

    private boolean withinWindow(Instant other, Instant current) {
        return Duration.between(other, current).abs().compareTo(window) < 0;
    }

    private String formatWindow() {
        long minutes = window.toMinutes();
        if (minutes % 60 == 0) {
            long hours = minutes / 60;
            return hours + (hours == 1 ? " hour" : " hours");
        }
        return minutes + " minutes";
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
