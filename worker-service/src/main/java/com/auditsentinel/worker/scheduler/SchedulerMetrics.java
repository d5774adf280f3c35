package com.auditsentinel.worker.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the task scheduler.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code auditsentinel.tasks.submitted} – tasks accepted by {@code submit}</li>
 *   <li>{@code auditsentinel.tasks.dispatched} – tasks handed to a unit</li>
 *   <li>{@code auditsentinel.tasks.completed} – tasks reported completed</li>
 *   <li>{@code auditsentinel.tasks.failed} – tasks reported failed, orphans included</li>
 *   <li>{@code auditsentinel.tasks.delivery.retries} – deliveries returned to the queue</li>
 *   <li>{@code auditsentinel.units.replaced} – crashed units replaced</li>
 *   <li>{@code auditsentinel.tasks.duration} – dispatch to terminal state</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class SchedulerMetrics {

    private final MeterRegistry registry;
    private final Counter submitted;
    private final Counter dispatched;
    private final Counter completed;
    private final Counter failed;
    private final Counter deliveryRetries;
    private final Counter unitsReplaced;
    private final Timer taskDuration;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.submitted = counter("auditsentinel.tasks.submitted", "Tasks accepted by the scheduler");
        this.dispatched = counter("auditsentinel.tasks.dispatched", "Tasks handed to a worker unit");
        this.completed = counter("auditsentinel.tasks.completed", "Tasks completed");
        this.failed = counter("auditsentinel.tasks.failed", "Tasks failed");
        this.deliveryRetries = counter("auditsentinel.tasks.delivery.retries", "Deliveries returned to the queue");
        this.unitsReplaced = counter("auditsentinel.units.replaced", "Crashed worker units replaced");
        this.taskDuration = Timer.builder("auditsentinel.tasks.duration")
                .description("Time from dispatch to a terminal state")
                .register(registry);
    }

    public void taskSubmitted() {
        submitted.increment();
    }

    public void taskDispatched() {
        dispatched.increment();
    }

    public void taskCompleted() {
        completed.increment();
    }

    public void taskFailed() {
        failed.increment();
    }

    public void deliveryRetried() {
        deliveryRetries.increment();
    }

    public void unitReplaced() {
        unitsReplaced.increment();
    }

    /**
     * @return a sample to pass to {@link #recordDuration} once the task ends
     */
    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void recordDuration(Timer.Sample sample) {
        if (sample != null) {
            sample.stop(taskDuration);
        }
    }

    // ---------------------------------------------------------------
    // Read access for the status log
    // ---------------------------------------------------------------

    public long getSubmitted() {
        return (long) submitted.count();
    }

    public long getDispatched() {
        return (long) dispatched.count();
    }

    public long getCompleted() {
        return (long) completed.count();
    }

    public long getFailed() {
        return (long) failed.count();
    }

    public long getDeliveryRetries() {
        return (long) deliveryRetries.count();
    }

    public long getUnitsReplaced() {
        return (long) unitsReplaced.count();
    }

    public double getMeanDurationMillis() {
        return taskDuration.mean(TimeUnit.MILLISECONDS);
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    @Override
    public String toString() {
        return "submitted=" + getSubmitted() +
                ", dispatched=" + getDispatched() +
                ", completed=" + getCompleted() +
                ", failed=" + getFailed() +
                ", deliveryRetries=" + getDeliveryRetries() +
                ", unitsReplaced=" + getUnitsReplaced();
    }
}
