package com.auditsentinel.core.correlation;

import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.detection.AnalysisContext;
import com.auditsentinel.core.detection.MitreCatalog;
import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.Identity;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Batch-level pass run once after every event has been through the
 * per-event rules.
 *
 * <h3>Detections</h3>
 * <ul>
 * <li><b>High activity</b>: an identity with more than
 * {@code highActivityThreshold} events raises one medium finding.</li>
 * <li><b>Shared IP</b>: a known IP address with more than
 * {@code sharedIpEventThreshold} events and more than
 * {@code sharedIpUserThreshold} distinct identities raises one high
 * finding.</li>
 * </ul>
 *
 * <p>
 * Groups are visited in first-seen order. Both passes are linear in the
 * batch size. Findings carry the correlation time rather than an event time.
 * </p>
 *
 * @since 1.0.0
 */
public class CrossEventCorrelator {

    private static final Logger LOG = LoggerFactory.getLogger(CrossEventCorrelator.class);

    public static final String HIGH_ACTIVITY_TYPE = "high_activity_user";
    public static final String SHARED_IP_TYPE = "shared_ip_access";

    private final int highActivityThreshold;
    private final int sharedIpEventThreshold;
    private final int sharedIpUserThreshold;
    private final Clock clock;

    public CrossEventCorrelator(AnalysisConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        this.highActivityThreshold = config.getCorrelation().getHighActivityThreshold();
        this.sharedIpEventThreshold = config.getCorrelation().getSharedIpEventThreshold();
        this.sharedIpUserThreshold = config.getCorrelation().getSharedIpUserThreshold();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Run both correlations over the whole batch.
     *
     * @param events  every normalized event of the run, in input order
     * @param context the run to report into
     */
    public void correlate(List<NormalizedEvent> events, AnalysisContext context) {
        Objects.requireNonNull(events, "events must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Map<Identity, Integer> perUser = new LinkedHashMap<>();
        Map<String, IpActivity> perIp = new LinkedHashMap<>();
        for (NormalizedEvent event : events) {
            perUser.merge(event.getIdentity(), 1, Integer::sum);
            if (!NormalizedEvent.isUnknown(event.getIpAddress())) {
                perIp.computeIfAbsent(event.getIpAddress(), ip -> new IpActivity()).add(event.getIdentity());
            }
        }

        Instant now = Instant.now(clock);
        int before = context.getFindings().size();

        perUser.forEach((identity, count) -> {
            if (count > highActivityThreshold) {
                context.report(Finding.builder()
                        .type(HIGH_ACTIVITY_TYPE)
                        .severity(Severity.MEDIUM)
                        .category("behavioral")
                        .title("Unusually High User Activity")
                        .description("User " + identity.render() + " performed " + count
                                + " activities - unusually high volume")
                        .timestamp(now)
                        .affectedEntities(AffectedEntities.builder().user(identity.render()).build())
                        .evidence("activityCount", count)
                        .mitreMapping(MitreCatalog.mappingFor(HIGH_ACTIVITY_TYPE))
                        .recommendations(MitreCatalog.recommendationsFor(HIGH_ACTIVITY_TYPE)));
            }
        });

        perIp.forEach((ip, activity) -> {
            int users = activity.users.size();
            if (activity.events > sharedIpEventThreshold && users > sharedIpUserThreshold) {
                context.report(Finding.builder()
                        .type(SHARED_IP_TYPE)
                        .severity(Severity.HIGH)
                        .category("security")
                        .title("Multiple Users from Same IP")
                        .description("IP " + ip + " used by " + users
                                + " different users - potential shared/compromised connection")
                        .timestamp(now)
                        .affectedEntities(AffectedEntities.builder()
                                .ipAddress(ip)
                                .users(activity.users.stream().map(Identity::render).toList())
                                .build())
                        .evidence("ipAddress", ip)
                        .evidence("userCount", users)
                        .evidence("activityCount", activity.events)
                        .mitreMapping(MitreCatalog.mappingFor(SHARED_IP_TYPE))
                        .recommendations(MitreCatalog.recommendationsFor(SHARED_IP_TYPE)));
            }
        });

        LOG.debug("Correlation over {} event(s) ({} identities, {} IPs) raised {} finding(s)",
                events.size(), perUser.size(), perIp.size(), context.getFindings().size() - before);
    }

    private static final class IpActivity {
        private int events;
        private final Set<Identity> users = new HashSet<>();

        void add(Identity identity) {
            events++;
            users.add(identity);
        }
    }
}
