package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.util.List;

/**
 * Raises one {@code permission_change} finding per event whose operation
 * adds, removes or modifies permissions, roles or admin rights.
 *
 * @since 1.0.0
 */
public class PermissionChangeRule extends PatternRule {

    public static final String RULE_NAME = "permission-change";

    static final String TYPE = "permission_change";
    static final String TITLE = "Permission Change Detected";

    static final List<OperationPattern> PATTERNS = List.of(
            permission("permission.*add|add.*permission"),
            permission("permission.*remove|remove.*permission"),
            permission("permission.*modify|modify.*permission"),
            permission("role.*assign|assign.*role"),
            permission("role.*remove|remove.*role"),
            permission("privilege.*escalat"),
            permission("admin.*add|add.*admin"));

    public PermissionChangeRule() {
        super(RULE_NAME, PATTERNS, true);
    }

    @Override
    protected void onMatch(NormalizedEvent event, OperationPattern pattern, AnalysisContext context) {
        List<String> targets = targetNames(event, "userPrincipalName", "displayName", "id");
        context.report(patternFinding(event, pattern)
                .title(TITLE)
                .description("Permission change detected: " + event.getOperation() + " by " + event.getUser())
                .category("security")
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .application(event.getApplication())
                        .operation(event.getOperation())
                        .targetResources(targets)
                        .build())
                .evidence("operation", event.getOperation())
                .evidence("matchedPattern", pattern.getRegex())
                .evidence("result", event.getResult())
                .evidence("targetResources", event.getTargetResources()));
    }

    private static OperationPattern permission(String regex) {
        return OperationPattern.of(regex, TYPE, Severity.HIGH, TITLE);
    }
}
