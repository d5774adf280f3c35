package com.auditsentinel.core.detection;

import com.auditsentinel.core.model.Finding;
import com.auditsentinel.core.model.NormalizedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one analysis run.
 *
 * <h3>Contents</h3>
 * <ul>
 * <li>the append-only finding list, with sequential ids
 * {@code finding_1}, {@code finding_2}, ...</li>
 * <li>the {@link StatisticsCollector}</li>
 * <li>a bounded window of the most recent preceding events, oldest
 * first</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. A context belongs to exactly one run, which is evaluated
 * sequentially.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisContext {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisContext.class);

    private final String source;
    private final int lookbackEvents;
    private final List<Finding> findings = new ArrayList<>();
    private final StatisticsCollector statistics = new StatisticsCollector();
    private final Deque<NormalizedEvent> recentEvents = new ArrayDeque<>();

    /**
     * @param source         value stamped on every finding's {@code source}
     * @param lookbackEvents capacity of the recent-event window; must be &gt; 0
     */
    public AnalysisContext(String source, int lookbackEvents) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        if (lookbackEvents < 1) {
            throw new IllegalArgumentException("lookbackEvents must be >= 1, got: " + lookbackEvents);
        }
        this.lookbackEvents = lookbackEvents;
    }

    /**
     * Assign the next finding id, stamp the source and append the finding.
     *
     * @param builder a finding builder with everything but id and source set
     * @return the appended finding
     */
    public Finding report(Finding.Builder builder) {
        Objects.requireNonNull(builder, "Finding builder must not be null");
        Finding finding = builder
                .id("finding_" + (findings.size() + 1))
                .source(source)
                .build();
        findings.add(finding);
        LOG.debug("Finding {} [{}/{}]: {}", finding.getId(), finding.getType(),
                finding.getSeverity().getLabel(), finding.getDescription());
        return finding;
    }

    /**
     * Push an evaluated event into the trailing window, evicting the oldest
     * once the window is full.
     *
     * @param event the event just evaluated
     */
    public void remember(NormalizedEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        if (recentEvents.size() == lookbackEvents) {
            recentEvents.pollFirst();
        }
        recentEvents.addLast(event);
    }

    /**
     * @return the preceding events, oldest first, at most {@code lookbackEvents}
     */
    public List<NormalizedEvent> getRecentEvents() {
        return List.copyOf(recentEvents);
    }

    /**
     * @return unmodifiable view of the findings so far
     */
    public List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    public StatisticsCollector getStatistics() {
        return statistics;
    }

    public String getSource() {
        return source;
    }
}
