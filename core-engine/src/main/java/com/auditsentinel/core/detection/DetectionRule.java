package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.NormalizedEvent;

/**
 * Contract for all per-event detection rules.
 * <p>
 * A rule inspects one normalized event and appends zero or more findings to
 * the run through {@link AnalysisContext#report}. It may also update the
 * run statistics. Rules hold no per-run state of their own: anything that
 * spans events, such as the trailing window used for brute-force detection,
 * lives in the context. One rule instance can therefore serve many runs,
 * but a single run is evaluated by one thread at a time.
 * </p>
 */
public interface DetectionRule {

    /**
     * Evaluate a single event.
     *
     * @param event   the normalized event
     * @param context the run being analysed
     */
    void evaluate(NormalizedEvent event, AnalysisContext context);

    /**
     * @return unique rule name, used in logs
     */
    String getRuleName();
}
