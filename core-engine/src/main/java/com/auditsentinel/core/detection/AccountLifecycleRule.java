package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.AffectedEntities;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.Severity;

import java.util.List;

/**
 * Tracks user account lifecycle operations: creation, deletion, disable,
 * enable and password changes.
 *
 * <p>
 * The user verbs only match when {@code user} and the verb are adjacent
 * words (optionally separated by {@code account} or {@code new}), so that an
 * operation such as {@code "Disable MFA for user"} is left to the
 * suspicious-operation table instead of also being reported as a disabled
 * account.
 * </p>
 *
 * @since 1.0.0
 */
public class AccountLifecycleRule extends PatternRule {

    public static final String RULE_NAME = "account-lifecycle";

    static final List<OperationPattern> PATTERNS = List.of(
            OperationPattern.of("\\buser\\W+(?:account\\W+)?creat|\\bcreat\\w*\\W+(?:new\\W+)?user",
                    "user_creation", Severity.MEDIUM, "User account creation detected"),
            OperationPattern.of("\\buser\\W+(?:account\\W+)?delet|\\bdelete\\w*\\W+user",
                    "user_deletion", Severity.HIGH, "User account deletion detected"),
            OperationPattern.of("\\buser\\W+(?:account\\W+)?disabl|\\bdisable\\w*\\W+user",
                    "user_disable", Severity.MEDIUM, "User account disable detected"),
            OperationPattern.of("\\buser\\W+(?:account\\W+)?enabl|\\benable\\w*\\W+user",
                    "user_enable", Severity.MEDIUM, "User account enable detected"),
            OperationPattern.of("password.*change|change.*password",
                    "password_change", Severity.LOW, "Password change detected"));

    public AccountLifecycleRule() {
        super(RULE_NAME, PATTERNS, false);
    }

    @Override
    protected void onMatch(NormalizedEvent event, OperationPattern pattern, AnalysisContext context) {
        context.report(patternFinding(event, pattern)
                .category("account_management")
                .affectedEntities(AffectedEntities.builder()
                        .user(event.getUser())
                        .operation(event.getOperation())
                        .targetResources(targetNames(event, "userPrincipalName", "displayName", "id"))
                        .build())
                .evidence("operation", event.getOperation())
                .evidence("result", event.getResult())
                .evidence("targetResources", event.getTargetResources()));
    }
}
