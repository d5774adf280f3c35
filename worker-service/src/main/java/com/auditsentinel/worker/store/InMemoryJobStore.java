package com.auditsentinel.worker.store;

import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * {@link JobStore} kept in a concurrent map. Records live until purged.
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All operations are atomic per task id.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryJobStore implements JobStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryJobStore.class);

    private final ConcurrentMap<String, TaskRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public TaskRecord register(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        TaskRecord record = TaskRecord.queued(task, clock.instant());
        if (records.putIfAbsent(task.getId(), record) != null) {
            throw new IllegalArgumentException("Task record already exists: " + task.getId());
        }
        return record;
    }

    @Override
    public void updateProgress(String taskId, int percent, TaskStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        update(taskId, "progress", current -> {
            if (current.getStatus().isTerminal()) {
                LOG.debug("Ignoring progress {}% for task {} in terminal state {}",
                        percent, taskId, current.getStatus());
                return current;
            }
            return current.withProgress(percent, status, clock.instant());
        });
    }

    @Override
    public void markCompleted(String taskId, Map<String, Object> result) {
        update(taskId, "completion", current -> {
            if (current.getStatus() == TaskStatus.FAILED) {
                LOG.warn("Ignoring completion of task {}: already failed", taskId);
                return current;
            }
            return current.completed(result, clock.instant());
        });
    }

    @Override
    public void markFailed(String taskId, TaskError error) {
        Objects.requireNonNull(error, "error must not be null");
        update(taskId, "failure", current -> {
            if (current.getStatus().isTerminal()) {
                LOG.warn("Ignoring failure of task {}: already {}", taskId, current.getStatus().getLabel());
                return current;
            }
            return current.failed(error, clock.instant());
        });
    }

    @Override
    public Optional<TaskRecord> find(String taskId) {
        return Optional.ofNullable(records.get(taskId));
    }

    @Override
    public int purgeTerminalBefore(Instant cutoff) {
        Objects.requireNonNull(cutoff, "cutoff must not be null");
        int removed = 0;
        for (Map.Entry<String, TaskRecord> entry : records.entrySet()) {
            TaskRecord r = entry.getValue();
            if (r.getStatus().isTerminal()
                    && r.getCompletedAt() != null
                    && r.getCompletedAt().isBefore(cutoff)
                    && records.remove(entry.getKey(), r)) {
                removed++;
            }
        }
        if (removed > 0) {
            LOG.info("Purged {} task record(s) completed before {}", removed, cutoff);
        }
        return removed;
    }

    /**
     * @return number of stored records
     */
    public int size() {
        return records.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void update(String taskId, String what, UnaryOperator<TaskRecord> change) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        TaskRecord updated = records.computeIfPresent(taskId, (id, current) -> change.apply(current));
        if (updated == null) {
            LOG.warn("No record for task {}; {} not stored", taskId, what);
        }
    }
}
