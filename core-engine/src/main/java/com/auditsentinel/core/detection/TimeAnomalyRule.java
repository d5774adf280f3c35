package com.auditsentinel.core.detection;

import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Flags activity outside business hours and on weekends.
 *
 * <p>
 * The event time is converted to the configured zone (the host default when
 * none is set). An hour strictly before {@code businessHours.start} or
 * strictly after {@code businessHours.end} is after-hours; Saturday and
 * Sunday are weekend. Both findings can be raised for the same event.
 * Events without a timestamp are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class TimeAnomalyRule implements DetectionRule {

    public static final String RULE_NAME = "time-anomaly";

    public static final String AFTER_HOURS_TYPE = "after_hours_activity";
    public static final String WEEKEND_TYPE = "weekend_activity";

    private final ZoneId zone;
    private final int businessStart;
    private final int businessEnd;

    public TimeAnomalyRule(AnalysisConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        this.zone = config.resolveZone();
        this.businessStart = config.getBusinessHours().getStart();
        this.businessEnd = config.getBusinessHours().getEnd();
    }

    @Override
    public void evaluate(NormalizedEvent event, AnalysisContext context) {
        Objects.requireNonNull(event, "event must not be null");
        Optional<Instant> timestamp = event.getTimestamp();
        if (timestamp.isEmpty()) {
            return;
        }

        ZonedDateTime local = timestamp.get().atZone(zone);
        int hour = local.getHour();
        DayOfWeek day = local.getDayOfWeek();

        if (hour < businessStart || hour > businessEnd) {
            context.report(base(event, timestamp.get(), AFTER_HOURS_TYPE, Severity.MEDIUM)
                    .title("After-hours Activity")
                    .description("User " + event.getUser() + " performed " + event.getOperation()
                            + " outside business hours (" + hour + ":00)")
                    .evidence("hour", hour)
                    .evidence("dayOfWeek", day.name())
                    .evidence("timeZone", zone.getId())
                    .evidence("operation", event.getOperation()));
        }

        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) {
            context.report(base(event, timestamp.get(), WEEKEND_TYPE, Severity.LOW)
                    .title("Weekend Activity")
                    .description("User " + event.getUser() + " performed " + event.getOperation()
                            + " during weekend")
                    .evidence("dayOfWeek", day.name())
                    .evidence("timeZone", zone.getId())
                    .evidence("operation", event.getOperation()));
        }
    }

    private static Finding.Builder base(NormalizedEvent event, Instant timestamp, String type, Severity severity) {
        return Finding.builder()
                .type(type)
                .severity(severity)
                .category("behavioral")
                .timestamp(timestamp)
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .operation(event.getOperation())
                        .ipAddress(event.getIpAddress())
                        .build())
                .mitreMapping(MitreCatalog.mappingFor(type))
                .recommendations(MitreCatalog.recommendationsFor(type));
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
