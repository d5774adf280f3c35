package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for rules driven by a fixed, ordered table of
 * {@link OperationPattern}s matched against the operation name.
 *
 * <p>
 * By default every matching row produces its own finding. Subclasses that
 * pass {@code firstMatchOnly} stop at the first matching row.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class PatternRule implements DetectionRule {

    private final String ruleName;
    private final List<OperationPattern> patterns;
    private final boolean firstMatchOnly;

    protected PatternRule(String ruleName, List<OperationPattern> patterns, boolean firstMatchOnly) {
        this.ruleName = Objects.requireNonNull(ruleName, "ruleName must not be null");
        this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
        this.firstMatchOnly = firstMatchOnly;
    }

    @Override
    public final void evaluate(NormalizedEvent event, AnalysisContext context) {
        Objects.requireNonNull(event, "event must not be null");
        if (NormalizedEvent.isUnknown(event.getOperation())) {
            return;
        }
        for (OperationPattern pattern : patterns) {
            if (pattern.matches(event.getOperation())) {
                onMatch(event, pattern, context);
                if (firstMatchOnly) {
                    return;
                }
            }
        }
    }

    /**
     * Report the finding for one matching row.
     *
     * @param event   the event whose operation matched
     * @param pattern the matching row
     * @param context the run
     */
    protected abstract void onMatch(NormalizedEvent event, OperationPattern pattern, AnalysisContext context);

    /**
     * Finding pre-filled from a pattern row: title, severity, type,
     * description, timestamp and the catalog's MITRE mapping and advice.
     */
    protected static Finding.Builder patternFinding(NormalizedEvent event, OperationPattern pattern) {
        return Finding.builder()
                .title(pattern.getDescription())
                .severity(pattern.getSeverity())
                .type(pattern.getType())
                .description(pattern.getDescription() + ": " + event.getOperation() + " by " + event.getUser())
                .timestamp(event.getTimestamp().orElse(null))
                .mitreMapping(MitreCatalog.mappingFor(pattern.getType()))
                .recommendations(MitreCatalog.recommendationsFor(pattern.getType()));
    }

    /**
     * Names of the event's target resources, taken from the first present
     * key of each resource object.
     *
     * @param event the event
     * @param keys  candidate keys in priority order
     * @return resource names, in event order
     */
    protected static List<String> targetNames(NormalizedEvent event, String... keys) {
        List<String> names = new ArrayList<>();
        for (Object resource : event.getTargetResources()) {
            if (!(resource instanceof Map<?, ?> map)) {
                continue;
            }
            for (String key : keys) {
                Object value = map.get(key);
                if (value != null && !value.toString().isBlank()) {
                    names.add(value.toString());
                    break;
                }
            }
        }
        return names;
    }

    public List<OperationPattern> getPatterns() {
        return patterns;
    }

    @Override
    public String getRuleName() {
        return ruleName;
    }
}
