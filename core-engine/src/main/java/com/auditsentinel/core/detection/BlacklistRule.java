package com.auditsentinel.core.detection;

import com.auditsentinel.core.config.BlacklistEntry;
import com.auditsentinel.core.config.Blacklists;
import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * Matches the event's application, location and user agent against the
 * configured denylists.
 *
 * <p>
 * Each of the three checks can fire independently for the same event.
 * Attributes that resolved to {@code Unknown} are never matched. Every hit
 * is also recorded in the run statistics, where it feeds the risk score.
 * </p>
 *
 * @since 1.0.0
 */
public class BlacklistRule implements DetectionRule {

    public static final String RULE_NAME = "blacklist";

    static final String APPLICATION_TYPE = "blacklisted_application";
    static final String COUNTRY_TYPE = "blacklisted_country";
    static final String USER_AGENT_TYPE = "blacklisted_user_agent";

    private final Blacklists blacklists;

    public BlacklistRule(Blacklists blacklists) {
        this.blacklists = Objects.requireNonNull(blacklists, "blacklists must not be null");
    }

    @Override
    public void evaluate(NormalizedEvent event, AnalysisContext context) {
        Objects.requireNonNull(event, "event must not be null");
        String user = event.getUser();

        if (!NormalizedEvent.isUnknown(event.getApplication())) {
            Optional<BlacklistEntry> hit = blacklists.matchApplication(event.getApplication());
            if (hit.isPresent()) {
                context.getStatistics().recordBlacklistedApplication(event.getApplication());
                context.report(base(event, APPLICATION_TYPE, Severity.HIGH)
                        .title("Blacklisted Application Detected")
                        .description("Blacklisted application \"" + event.getApplication() + "\" was used by " + user)
                        .evidence("application", event.getApplication())
                        .evidence("blacklistReason", reasonOf(hit.get(), "Application is on blacklist"))
                        .evidence("operation", event.getOperation())
                        .evidence("ipAddress", event.getIpAddress()));
            }
        }

        if (!NormalizedEvent.isUnknown(event.getLocation())) {
            Optional<BlacklistEntry> hit = blacklists.matchCountry(event.getLocation());
            if (hit.isPresent()) {
                context.getStatistics().recordBlacklistedCountry(event.getLocation());
                context.report(base(event, COUNTRY_TYPE, Severity.HIGH)
                        .title("Access from Blacklisted Country")
                        .description("User " + user + " accessed from blacklisted country: " + event.getLocation())
                        .evidence("location", event.getLocation())
                        .evidence("blacklistReason", reasonOf(hit.get(), "Country is on blacklist"))
                        .evidence("operation", event.getOperation())
                        .evidence("ipAddress", event.getIpAddress()));
            }
        }

        if (!NormalizedEvent.isUnknown(event.getUserAgent())) {
            Optional<BlacklistEntry> hit = blacklists.matchUserAgent(event.getUserAgent());
            if (hit.isPresent()) {
                context.getStatistics().recordBlacklistedUserAgent(event.getUserAgent());
                context.report(base(event, USER_AGENT_TYPE, Severity.MEDIUM)
                        .title("Blacklisted User Agent Detected")
                        .description("Blacklisted user agent \"" + event.getUserAgent() + "\" used by " + user)
                        .evidence("userAgent", event.getUserAgent())
                        .evidence("blacklistReason", reasonOf(hit.get(), "User agent is on blacklist"))
                        .evidence("operation", event.getOperation())
                        .evidence("ipAddress", event.getIpAddress()));
            }
        }
    }

    private static Finding.Builder base(NormalizedEvent event, String type, Severity severity) {
        return Finding.builder()
                .type(type)
                .severity(severity)
                .category("security")
                .timestamp(event.getTimestamp().orElse(null))
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .application(event.getApplication())
                        .ipAddress(event.getIpAddress())
                        .location(event.getLocation())
                        .userAgent(event.getUserAgent())
                        .build())
                .mitreMapping(MitreCatalog.mappingFor(type))
                .recommendations(MitreCatalog.recommendationsFor(type));
    }

    private static String reasonOf(BlacklistEntry entry, String fallback) {
        String reason = entry.getReason();
        return reason == null || reason.isBlank() ? fallback : reason;
    }

    @Override
    public String getRuleName() {
        return RULE_NAME;
    }
}
