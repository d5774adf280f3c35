package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.Severity;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One row of a pattern table: a case-insensitive regular expression over
 * the operation name and the finding it produces.
 *
 * @since 1.0.0
 */
public final class OperationPattern {

    private final Pattern pattern;
    private final String type;
    private final Severity severity;
    private final String description;

    private OperationPattern(String regex, String type, Severity severity, String description) {
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex must not be null"),
                Pattern.CASE_INSENSITIVE);
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.description = Objects.requireNonNull(description, "description must not be null");
    }

    public static OperationPattern of(String regex, String type, Severity severity, String description) {
        return new OperationPattern(regex, type, severity, description);
    }

    /**
     * @param operation operation name
     * @return {@code true} if the expression is found anywhere in the name
     */
    public boolean matches(String operation) {
        return operation != null && pattern.matcher(operation).find();
    }

    public String getRegex() {
        return pattern.pattern();
    }

    public String getType() {
        return type;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return type + "(" + pattern.pattern() + ")";
    }
}
