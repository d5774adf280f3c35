package com.auditsentinel.core.analysis;

import com.auditsentinel.core.config.AnalysisConfig;
import com.auditsentinel.core.config.Blacklists;
import com.auditsentinel.core.correlation.CrossEventCorrelator;
import com.auditsentinel.core.detection.AnalysisContext;
import com.auditsentinel.core.detection.RuleSet;
import com.auditsentinel.core.model.AnalysisResult;
import com.auditsentinel.core.model.AuditRecord;
import com.auditsentinel.core.model.NormalizedEvent;
import com.auditsentinel.core.model.RunStatistics;
import com.auditsentinel.core.model.RunSummary;
import com.auditsentinel.core.normalize.EventNormalizer;
import com.auditsentinel.core.scoring.RecommendationAdvisor;
import com.auditsentinel.core.scoring.RiskScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a complete analysis over one batch of raw audit records.
 *
 * <h3>Pipeline</h3>
 * <ol>
 * <li>normalize each record and count it in the run statistics</li>
 * <li>apply the {@link RuleSet} to the event, then push it into the
 * trailing window</li>
 * <li>correlate across the whole batch</li>
 * <li>summarize, score and derive run-level recommendations</li>
 * </ol>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The engine itself is immutable and may be shared. Each call to
 * {@link #analyze(List)} works on its own {@link AnalysisContext}, so
 * concurrent runs never share state.
 * </p>
 *
 * @since 1.0.0
 */
public class AnalysisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisEngine.class);

    private final AnalysisConfig config;
    private final EventNormalizer normalizer = new EventNormalizer();
    private final RuleSet rules;
    private final CrossEventCorrelator correlator;

    public AnalysisEngine(AnalysisConfig config, Blacklists blacklists) {
        this(config, blacklists, Clock.systemUTC());
    }

    public AnalysisEngine(AnalysisConfig config, Blacklists blacklists, Clock clock) {
        this(config, RuleSet.standard(config, blacklists), clock);
    }

    /**
     * @param config analysis settings
     * @param rules  per-event rules, in evaluation order
     * @param clock  time source for correlation findings
     */
    public AnalysisEngine(AnalysisConfig config, RuleSet rules, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        this.correlator = new CrossEventCorrelator(config, clock);
    }

    /**
     * Analyze one batch.
     *
     * @param records raw records in input order; may be empty
     * @return findings, statistics, summary and recommendations
     */
    public AnalysisResult analyze(List<AuditRecord> records) {
        Objects.requireNonNull(records, "records must not be null");
        long started = System.nanoTime();

        AnalysisContext context = new AnalysisContext(config.getSource(), config.getBruteForce().getLookbackEvents());
        List<NormalizedEvent> events = new ArrayList<>(records.size());
        for (AuditRecord record : records) {
            NormalizedEvent event = normalizer.normalize(record);
            events.add(event);
            context.getStatistics().record(event);
            rules.evaluate(event, context);
            context.remember(event);
        }

        correlator.correlate(events, context);

        RunStatistics statistics = context.getStatistics().snapshot();
        RunSummary summary = RiskScorer.summarize(context.getFindings(), statistics);
        AnalysisResult result = new AnalysisResult(
                context.getFindings(),
                statistics,
                summary,
                RecommendationAdvisor.advise(context.getFindings(), statistics));

        LOG.info("Analyzed {} event(s) in {} ms: {} finding(s), risk score {}, {} unknown-user event(s)",
                statistics.getTotalEvents(),
                (System.nanoTime() - started) / 1_000_000,
                summary.getTotalFindings(),
                summary.getRiskScore(),
                statistics.getDataQuality().getUnknownUserEvents());
        return result;
    }

    public RuleSet getRules() {
        return rules;
    }
}
