package com.auditsentinel.core.detection;

import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.config.Blacklists;
import com.auditsentinel.core.model.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, immutable collection of {@link DetectionRule}s applied to each
 * event of a run.
 *
 * <p>
 * Rules run in registration order, so finding ids within a run follow that
 * order for each event. {@link #standard(AnalysisConfig, Blacklists)} builds
 * the production rule order: blacklist, suspicious operation, time anomaly,
 * permission change, account lifecycle, application lifecycle, brute force.
 * </p>
 *
 * @since 1.0.0
 */
public final class RuleSet {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSet.class);

    private final List<DetectionRule> rules;

    private RuleSet(List<DetectionRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * @param config     analysis settings
     * @param blacklists loaded denylists
     * @return the seven production rules in evaluation order
     */
    public static RuleSet standard(AnalysisConfig config, Blacklists blacklists) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(blacklists, "blacklists must not be null");
        return builder()
                .add(new BlacklistRule(blacklists))
                .add(new SuspiciousOperationRule())
                .add(new TimeAnomalyRule(config))
                .add(new PermissionChangeRule())
                .add(new AccountLifecycleRule())
                .add(new ApplicationLifecycleRule())
                .add(new BruteForceRule(config))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Run every rule against one event.
     *
     * @param event   the event
     * @param context the run
     */
    public void evaluate(NormalizedEvent event, AnalysisContext context) {
        for (DetectionRule rule : rules) {
            rule.evaluate(event, context);
        }
    }

    public List<DetectionRule> getRules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static final class Builder {
        private final List<DetectionRule> rules = new ArrayList<>();

        private Builder() {
        }

        public Builder add(DetectionRule rule) {
            Objects.requireNonNull(rule, "rule must not be null");
            for (DetectionRule existing : rules) {
                if (existing.getRuleName().equals(rule.getRuleName())) {
                    throw new IllegalArgumentException("Duplicate rule name: " + rule.getRuleName());
                }
            }
            rules.add(rule);
            return this;
        }

        public RuleSet build() {
            LOG.info("Registered {} detection rule(s)", rules.size());
            return new RuleSet(rules);
        }
    }
}
