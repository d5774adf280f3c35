package com.auditsentinel.core.detection;

import com.auditsentinel.core.config.BlacklistEntry;
import com.auditsentinel.core.config.Blacklists;
import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.RunStatistics;
import com.auditsentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.auditsentinel.core.EventFixtures.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link BlacklistRule}.
 */
class BlacklistRuleTest {

    private BlacklistRule rule;
    private AnalysisContext context;

    @BeforeEach
    void setUp() {
        rule = new BlacklistRule(new Blacklists(
                List.of(new BlacklistEntry("rclone", "Bulk copy tool")),
                List.of(new BlacklistEntry("North Korea", null)),
                List.of(new BlacklistEntry("python-requests", "Scripted client"))));
        context = new AnalysisContext("entra_audit_logs", 100);
    }

    @Test
    @DisplayName("Should raise one finding per blacklisted attribute in fixed order")
    void shouldRaiseAllThreeChecks() {
        rule.evaluate(event("alice@contoso.com", "Sign-in")
                .application("RClone")
                .location("North Korea")
                .userAgent("python-requests/2.31")
                .build(), context);

        List<Finding> findings = context.getFindings();
        assertThat(findings).extracting(Finding::getType).containsExactly(
                "blacklisted_application", "blacklisted_country", "blacklisted_user_agent");
        assertThat(findings).extracting(Finding::getSeverity).containsExactly(
                Severity.HIGH, Severity.HIGH, Severity.MEDIUM);
        assertThat(findings.get(0).getDescription())
                .isEqualTo("Blacklisted application \"RClone\" was used by alice@contoso.com");
        assertThat(findings.get(1).getDescription())
                .isEqualTo("User alice@contoso.com accessed from blacklisted country: North Korea");
        assertThat(findings.get(0).getEvidence()).containsEntry("blacklistReason", "Bulk copy tool");
        assertThat(findings.get(1).getEvidence()).containsEntry("blacklistReason", "Country is on blacklist");
    }

    @Test
    @DisplayName("Should record each distinct blacklisted value once in the statistics")
    void shouldRecordDistinctHits() {
        for (int i = 0; i < 3; i++) {
            rule.evaluate(event("user" + i + "@contoso.com", "Sign-in").application("rclone").build(), context);
        }

        RunStatistics stats = context.getStatistics().snapshot();
        assertThat(context.getFindings()).hasSize(3);
        assertThat(stats.getBlacklistedEntities().getApplications()).containsExactly("rclone");
        assertThat(stats.getBlacklistedEntities().getCountries()).isEmpty();
    }

    @Test
    @DisplayName("Should never match unknown attributes")
    void shouldSkipUnknownAttributes() {
        rule.evaluate(event("alice@contoso.com", "Sign-in").build(), context);

        assertThat(context.getFindings()).isEmpty();
    }
}
