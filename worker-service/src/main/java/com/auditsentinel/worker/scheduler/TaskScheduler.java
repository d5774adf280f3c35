package com.auditsentinel.worker.scheduler;

import com.auditsentinel.worker.store.JobStore;
import com.auditsentinel.worker.store.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Priority task queue feeding a fixed pool of {@link WorkerUnit}s.
 *
 * <h3>Dispatch</h3>
 * <p>
 * Submitted tasks are queued and the queue is re-sorted by priority after
 * every submission; the sort is stable, so tasks of one priority leave in
 * submission order. The dispatch loop hands the head task to the first
 * idle unit: one that has posted {@code ready} and has no entry in the
 * active-task registry. When no unit is idle, or a delivery fails, the loop
 * waits for the dispatch backoff and tries again. A task whose delivery
 * failed goes back to the head of the queue. Running tasks are never
 * preempted.
 * </p>
 *
 * <h3>Unit lifecycle</h3>
 * <p>
 * A unit that crashes is discarded and a new unit is created in the same
 * slot. What happens to the task it was running is decided by the
 * {@link OrphanPolicy}. Frames that still arrive from a replaced unit are
 * ignored.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * The queue and the registries are owned by one scheduler thread; public
 * methods and unit callbacks only enqueue work for it. {@link #status()},
 * {@link #start()} and {@link #shutdown()} wait for that work to finish.
 * </p>
 *
 * @since 1.0.0
 */
public class TaskScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    private static final Comparator<Task> PRIORITY_ORDER = Comparator.comparingInt(t -> t.getPriority().rank());

    private final int poolSize;
    private final Duration dispatchBackoff;
    private final OrphanPolicy orphanPolicy;
    private final WorkerUnitFactory unitFactory;
    private final JobStore jobStore;
    private final MessageCodec codec;
    private final SchedulerMetrics metrics;
    private final ScheduledExecutorService loop;
    private final UnitListener listener = new Listener();

    // ---------------------------------------------------------------
    // Owned by the scheduler thread
    // ---------------------------------------------------------------
    private final List<Task> queue = new ArrayList<>();
    private final Map<Integer, WorkerUnit> units = new TreeMap<>();
    private final Set<Integer> readySlots = new HashSet<>();
    private final Map<Integer, String> activeTasks = new TreeMap<>();
    private final Map<String, Timer.Sample> timers = new HashMap<>();
    private boolean processing;
    private ScheduledFuture<?> pendingRetry;

    private final Set<String> seenTaskIds = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private TaskScheduler(Builder b) {
        this.poolSize = b.poolSize;
        this.dispatchBackoff = b.dispatchBackoff;
        this.orphanPolicy = b.orphanPolicy;
        this.unitFactory = b.unitFactory;
        this.jobStore = b.jobStore;
        this.codec = b.codec != null ? b.codec : new MessageCodec();
        this.metrics = b.metrics != null ? b.metrics : new SchedulerMetrics(new SimpleMeterRegistry());
        this.loop = b.loop != null ? b.loop : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "task-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Create and start one unit per slot.
     *
     * @throws IllegalStateException if already started or shut down
     */
    public void start() {
        requireRunning();
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already started");
        }
        onLoop(() -> {
            for (int slot = 0; slot < poolSize; slot++) {
                createUnit(slot);
            }
            return null;
        });
        LOG.info("Task scheduler started with {} worker(s), orphan policy {}", poolSize, orphanPolicy);
    }

    /**
     * Queue a task and start dispatching if the loop is idle.
     *
     * @param task the task
     * @throws IllegalArgumentException if a task with the same id was submitted before
     * @throws IllegalStateException    if the scheduler is shut down, also when
     *                                  shutdown happens while the task is handed over
     */
    public void submit(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        requireRunning();
        if (!seenTaskIds.add(task.getId())) {
            throw new IllegalArgumentException("Duplicate task id: " + task.getId());
        }
        try {
            loop.execute(() -> enqueue(task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Scheduler is shut down", e);
        }
        metrics.taskSubmitted();
    }

    /**
     * @return snapshot of pool, queue and registry
     */
    public SchedulerStatus status() {
        if (stopped.get()) {
            return SchedulerStatus.stopped();
        }
        try {
            return onLoop(() -> new SchedulerStatus(
                    units.size(),
                    activeTasks.size(),
                    queue.size(),
                    new ArrayList<>(activeTasks.values()),
                    queue.stream().map(Task::getId).toList(),
                    processing));
        } catch (RejectedExecutionException e) {
            return SchedulerStatus.stopped();
        }
    }

    /**
     * Terminate every unit and clear the queue and the registry. Queued and
     * in-flight tasks are abandoned, not failed.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        int abandoned = onLoop(() -> {
            int inFlight = activeTasks.size() + queue.size();
            units.values().forEach(WorkerUnit::terminate);
            units.clear();
            readySlots.clear();
            activeTasks.clear();
            queue.clear();
            timers.clear();
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
                pendingRetry = null;
            }
            processing = false;
            return inFlight;
        });
        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Task scheduler shut down; {} task(s) abandoned", abandoned);
    }

    public SchedulerMetrics getMetrics() {
        return metrics;
    }

    public int getPoolSize() {
        return poolSize;
    }

    // ---------------------------------------------------------------
    // Queue and dispatch (scheduler thread)
    // ---------------------------------------------------------------

    private void enqueue(Task task) {
        queue.add(task);
        queue.sort(PRIORITY_ORDER);
        LOG.info("Task {} queued with priority {} ({} queued)", task.getId(), task.getPriority().getLabel(), queue.size());
        if (!processing) {
            processing = true;
            dispatchNext();
        }
    }

    private void kick() {
        if (!queue.isEmpty()) {
            processing = true;
            dispatchNext();
        }
    }

    private void dispatchNext() {
        while (!queue.isEmpty()) {
            if (stopped.get()) {
                break;
            }
            Integer slot = findIdleSlot();
            if (slot == null) {
                LOG.debug("No idle worker; retrying in {} ms", dispatchBackoff.toMillis());
                scheduleRetry();
                return;
            }
            Task task = queue.remove(0);
            activeTasks.put(slot, task.getId());
            try {
                units.get(slot).send(task);
            } catch (TaskDeliveryException e) {
                activeTasks.remove(slot);
                queue.add(0, task);
                metrics.deliveryRetried();
                LOG.warn("Failed to deliver task {} to worker {}; requeued at head: {}",
                        task.getId(), slot, e.getMessage());
                scheduleRetry();
                return;
            }
            timers.put(task.getId(), metrics.startTimer());
            metrics.taskDispatched();
            LOG.info("Dispatched task {} to worker {}", task.getId(), slot);
        }
        processing = false;
    }

    private Integer findIdleSlot() {
        for (Integer slot : units.keySet()) {
            if (readySlots.contains(slot) && !activeTasks.containsKey(slot)) {
                return slot;
            }
        }
        return null;
    }

    private void scheduleRetry() {
        processing = true;
        if (pendingRetry == null) {
            pendingRetry = loop.schedule(() -> {
                pendingRetry = null;
                dispatchNext();
            }, dispatchBackoff.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    // ---------------------------------------------------------------
    // Unit frames (scheduler thread)
    // ---------------------------------------------------------------

    private void handleFrame(WorkerUnit unit, String frame) {
        int slot = unit.getSlot();
        if (units.get(slot) != unit) {
            LOG.warn("Ignoring frame from replaced worker {}", slot);
            return;
        }
        WorkerMessage message;
        try {
            message = codec.decodeMessage(frame);
        } catch (JsonProcessingException e) {
            LOG.warn("Ignoring malformed frame from worker {}: {}", slot, e.getOriginalMessage());
            return;
        }
        switch (message.getType()) {
            case READY -> {
                readySlots.add(slot);
                LOG.info("Worker {} ready", slot);
                kick();
            }
            case STARTED -> {
                activeTasks.put(slot, message.getTaskId());
                LOG.debug("Worker {} started task {}", slot, message.getTaskId());
            }
            case PROGRESS -> {
                int percent = message.getPercent() != null ? message.getPercent() : 0;
                LOG.debug("Task {} at {}%: {}", message.getTaskId(), percent, message.getMessage());
                persist("progress", message.getTaskId(),
                        () -> jobStore.updateProgress(message.getTaskId(), percent, TaskStatus.forProgress(percent)));
            }
            case COMPLETED -> {
                persist("completion", message.getTaskId(),
                        () -> jobStore.markCompleted(message.getTaskId(), message.getResult()));
                release(message.getTaskId());
                metrics.taskCompleted();
                LOG.info("Task {} completed on worker {}", message.getTaskId(), slot);
                kick();
            }
            case FAILED -> {
                persist("failure", message.getTaskId(),
                        () -> jobStore.markFailed(message.getTaskId(), message.getError()));
                release(message.getTaskId());
                metrics.taskFailed();
                LOG.error("Task {} failed on worker {}: {}", message.getTaskId(), slot,
                        message.getError() != null ? message.getError().getMessage() : "no error reported");
                kick();
            }
        }
    }

    private void release(String taskId) {
        activeTasks.values().removeIf(taskId::equals);
        metrics.recordDuration(timers.remove(taskId));
    }

    // ---------------------------------------------------------------
    // Unit replacement (scheduler thread)
    // ---------------------------------------------------------------

    private void replaceUnit(WorkerUnit unit, Throwable cause) {
        int slot = unit.getSlot();
        if (units.get(slot) != unit) {
            LOG.warn("Ignoring crash report from replaced worker {}", slot);
            return;
        }
        LOG.error("Worker {} terminated unexpectedly: {}", slot, cause.toString());
        unit.terminate();
        units.remove(slot);
        readySlots.remove(slot);

        String orphan = activeTasks.get(slot);
        if (orphan != null) {
            handleOrphan(slot, orphan, cause);
        }

        createUnit(slot);
        metrics.unitReplaced();
        LOG.info("Replaced worker {}", slot);
        kick();
    }

    private void handleOrphan(int slot, String taskId, Throwable cause) {
        switch (orphanPolicy) {
            case FAIL -> {
                activeTasks.remove(slot);
                metrics.recordDuration(timers.remove(taskId));
                metrics.taskFailed();
                TaskError error = new TaskError("Worker " + slot + " terminated unexpectedly", cause.toString());
                persist("failure", taskId, () -> jobStore.markFailed(taskId, error));
                LOG.warn("Task {} failed: worker {} terminated while running it", taskId, slot);
            }
            case ABANDON -> LOG.warn("Task {} orphaned on worker {}; slot stays reserved", taskId, slot);
        }
    }

    private void createUnit(int slot) {
        WorkerUnit unit = unitFactory.create(slot, listener);
        units.put(slot, unit);
        unit.start();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void persist(String what, String taskId, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            LOG.error("Failed to store {} of task {}: {}", what, taskId, e.getMessage(), e);
        }
    }

    private void requireRunning() {
        if (stopped.get()) {
            throw new IllegalStateException("Scheduler is shut down");
        }
    }

    private void runOnLoop(Runnable action) {
        try {
            loop.execute(action);
        } catch (RejectedExecutionException e) {
            LOG.debug("Scheduler stopped; dropping late event");
        }
    }

    private <T> T onLoop(Callable<T> action) {
        Future<T> future = loop.submit(action);
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the scheduler", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        }
    }

    /**
     * Hands unit callbacks over to the scheduler thread.
     */
    private final class Listener implements UnitListener {

        @Override
        public void onFrame(WorkerUnit unit, String frame) {
            runOnLoop(() -> handleFrame(unit, frame));
        }

        @Override
        public void onCrash(WorkerUnit unit, Throwable cause) {
            runOnLoop(() -> replaceUnit(unit, cause));
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link TaskScheduler}. {@code unitFactory} and
     * {@code jobStore} are required.
     */
    public static class Builder {
        private int poolSize = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private Duration dispatchBackoff = Duration.ofSeconds(1);
        private OrphanPolicy orphanPolicy = OrphanPolicy.FAIL;
        private WorkerUnitFactory unitFactory;
        private JobStore jobStore;
        private MessageCodec codec;
        private SchedulerMetrics metrics;
        private ScheduledExecutorService loop;

        public Builder poolSize(int v) {
            this.poolSize = v;
            return this;
        }

        public Builder dispatchBackoff(Duration v) {
            this.dispatchBackoff = v;
            return this;
        }

        public Builder orphanPolicy(OrphanPolicy v) {
            this.orphanPolicy = v;
            return this;
        }

        public Builder unitFactory(WorkerUnitFactory v) {
            this.unitFactory = v;
            return this;
        }

        public Builder jobStore(JobStore v) {
            this.jobStore = v;
            return this;
        }

        public Builder codec(MessageCodec v) {
            this.codec = v;
            return this;
        }

        public Builder metrics(SchedulerMetrics v) {
            this.metrics = v;
            return this;
        }

        Builder loop(ScheduledExecutorService v) {
            this.loop = v;
            return this;
        }

        /**
         * @return a scheduler ready to {@link TaskScheduler#start()}
         * @throws IllegalArgumentException if a value is out of range
         */
        public TaskScheduler build() {
            Objects.requireNonNull(unitFactory, "unitFactory required");
            Objects.requireNonNull(jobStore, "jobStore required");
            Objects.requireNonNull(orphanPolicy, "orphanPolicy required");
            Objects.requireNonNull(dispatchBackoff, "dispatchBackoff required");
            if (poolSize < 1) {
                throw new IllegalArgumentException("poolSize must be >= 1, got: " + poolSize);
            }
            if (dispatchBackoff.isNegative() || dispatchBackoff.isZero()) {
                throw new IllegalArgumentException("dispatchBackoff must be positive, got: " + dispatchBackoff);
            }
            return new TaskScheduler(this);
        }
    }
}
