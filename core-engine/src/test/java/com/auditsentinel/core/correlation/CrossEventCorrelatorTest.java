package com.auditsentinel.core.correlation;

import com.auditsentinel.core.EventFixtures;
import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.detection.AnalysisContext;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.auditsentinel.core.EventFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CrossEventCorrelator}.
 */
class CrossEventCorrelatorTest {

    private static final Instant NOW = Instant.parse("2024-02-01T12:00:00Z");

    private CrossEventCorrelator correlator;
    private AnalysisContext context;

    @BeforeEach
    void setUp() {
        correlator = new CrossEventCorrelator(EventFixtures.utcConfig(), Clock.fixed(NOW, ZoneOffset.UTC));
        context = new AnalysisContext("entra_audit_logs", 100);
    }

    @Test
    @DisplayName("Should raise one high-activity finding for a user above 1000 events")
    void shouldFlagHighActivityUser() {
        List<NormalizedEvent> events = new ArrayList<>();
        for (int i = 0; i < 1001; i++) {
            events.add(event("alice@contoso.com", "FileAccessed").build());
        }

        correlator.correlate(events, context);

        assertThat(context.getFindings()).hasSize(1);
        Finding finding = context.getFindings().get(0);
        assertThat(finding.getType()).isEqualTo(CrossEventCorrelator.HIGH_ACTIVITY_TYPE);
        assertThat(finding.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(finding.getTimestamp()).isEqualTo(NOW);
        assertThat(finding.getEvidence()).containsEntry("activityCount", 1001);
        assertThat(finding.getDescription())
                .isEqualTo("User alice@contoso.com performed 1001 activities - unusually high volume");
    }

    @Test
    @DisplayName("Should NOT flag a user at exactly the threshold")
    void shouldNotFlagAtThreshold() {
        List<NormalizedEvent> events = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            events.add(event("alice@contoso.com", "FileAccessed").build());
        }

        correlator.correlate(events, context);

        assertThat(context.getFindings()).isEmpty();
    }

    @Test
    @DisplayName("Should flag an IP shared by many users with heavy traffic")
    void shouldFlagSharedIp() {
        List<NormalizedEvent> events = new ArrayList<>();
        for (int i = 0; i < 501; i++) {
            events.add(event("user" + (i % 11) + "@contoso.com", "Sign-in").ipAddress("203.0.113.9").build());
        }

        correlator.correlate(events, context);

        assertThat(context.getFindings()).hasSize(1);
        Finding finding = context.getFindings().get(0);
        assertThat(finding.getType()).isEqualTo(CrossEventCorrelator.SHARED_IP_TYPE);
        assertThat(finding.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(finding.getEvidence())
                .containsEntry("userCount", 11)
                .containsEntry("activityCount", 501);
        assertThat(finding.getAffectedEntities().getUsers()).hasSize(11);
    }

    @Test
    @DisplayName("Should NOT flag an IP with too few distinct users")
    void shouldRequireBothIpThresholds() {
        List<NormalizedEvent> events = new ArrayList<>();
        for (int i = 0; i < 600; i++) {
            events.add(event("user" + (i % 10) + "@contoso.com", "Sign-in").ipAddress("203.0.113.9").build());
        }

        correlator.correlate(events, context);

        assertThat(context.getFindings()).isEmpty();
    }

    @Test
    @DisplayName("Should never group on the unknown IP sentinel")
    void shouldIgnoreUnknownIp() {
        AnalysisConfig config = EventFixtures.utcConfig();
        config.getCorrelation().setSharedIpEventThreshold(1);
        config.getCorrelation().setSharedIpUserThreshold(1);
        CrossEventCorrelator lenient = new CrossEventCorrelator(config, Clock.fixed(NOW, ZoneOffset.UTC));

        lenient.correlate(List.of(
                event("a@contoso.com", "Sign-in").build(),
                event("b@contoso.com", "Sign-in").build(),
                event("c@contoso.com", "Sign-in").build()), context);

        assertThat(context.getFindings()).isEmpty();
    }
}
