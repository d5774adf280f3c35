package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.util.List;

/**
 * Flags operations that are sensitive on their own: credential resets,
 * role and permission grants, user deletion, admin consent, conditional
 * access changes and MFA being switched off.
 *
 * <p>
 * Every matching row raises its own finding, and each match is counted in
 * the run statistics as a suspicious activity.
 * </p>
 *
 * @since 1.0.0
 */
public class SuspiciousOperationRule extends PatternRule {

    public static final String RULE_NAME = "suspicious-operation";

    static final List<OperationPattern> PATTERNS = List.of(
            OperationPattern.of("password.*reset", "password_reset", Severity.MEDIUM,
                    "Password reset activity detected"),
            OperationPattern.of("role.*add|add.*role", "role_assignment", Severity.HIGH,
                    "Role assignment activity detected"),
            OperationPattern.of("permission.*grant|grant.*permission", "permission_grant", Severity.HIGH,
                    "Permission grant activity detected"),
            OperationPattern.of("delete.*user|remove.*user", "user_deletion", Severity.HIGH,
                    "User deletion activity detected"),
            OperationPattern.of("admin.*consent|consent.*admin", "admin_consent", Severity.CRITICAL,
                    "Admin consent activity detected"),
            OperationPattern.of("conditional.*access", "conditional_access", Severity.MEDIUM,
                    "Conditional access policy change detected"),
            OperationPattern.of("mfa.*disable|disable.*mfa", "mfa_disable", Severity.CRITICAL,
                    "MFA disable activity detected"));

    public SuspiciousOperationRule() {
        super(RULE_NAME, PATTERNS, false);
    }

    @Override
    protected void onMatch(NormalizedEvent event, OperationPattern pattern, AnalysisContext context) {
        context.getStatistics().recordSuspicious(pattern.getSeverity());
        context.report(patternFinding(event, pattern)
                .category("security")
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .application(event.getApplication())
                        .ipAddress(event.getIpAddress())
                        .location(event.getLocation())
                        .operation(event.getOperation())
                        .build())
                .evidence("operation", event.getOperation())
                .evidence("result", event.getResult())
                .evidence("ipAddress", event.getIpAddress())
                .evidence("userAgent", event.getUserAgent())
                .evidence("targetResources", event.getTargetResources()));
    }
}
