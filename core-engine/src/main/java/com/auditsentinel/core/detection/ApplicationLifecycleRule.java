package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.util.List;

/**
 * Tracks application registrations, service principals and OAuth consent.
 *
 * @since 1.0.0
 */
public class ApplicationLifecycleRule extends PatternRule {

    public static final String RULE_NAME = "application-lifecycle";

    static final List<OperationPattern> PATTERNS = List.of(
            OperationPattern.of("application.*create|create.*application", "app_creation", Severity.MEDIUM,
                    "Application creation detected"),
            OperationPattern.of("application.*delete|delete.*application", "app_deletion", Severity.HIGH,
                    "Application deletion detected"),
            OperationPattern.of("service.*principal", "service_principal", Severity.MEDIUM,
                    "Service principal activity detected"),
            OperationPattern.of("oauth.*consent|consent.*oauth", "oauth_consent", Severity.HIGH,
                    "OAuth consent activity detected"));

    public ApplicationLifecycleRule() {
        super(RULE_NAME, PATTERNS, false);
    }

    @Override
    protected void onMatch(NormalizedEvent event, OperationPattern pattern, AnalysisContext context) {
        context.report(patternFinding(event, pattern)
                .category("application_management")
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .application(event.getApplication())
                        .operation(event.getOperation())
                        .targetResources(targetNames(event, "displayName", "id"))
                        .build())
                .evidence("operation", event.getOperation())
                .evidence("result", event.getResult())
                .evidence("application", event.getApplication())
                .evidence("targetResources", event.getTargetResources()));
    }
}
