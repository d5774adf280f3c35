package com.auditsentinel.worker.scheduler;

import com.auditsentinel.worker.store.InMemoryJobStore;
import com.auditsentinel.worker.store.JobStore;
import com.auditsentinel.worker.store.TaskRecord;
import com.auditsentinel.worker.store.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link TaskScheduler}, driven through scripted units.
 *
 * <p>
 * Unit frames are handled on the scheduler thread in arrival order, so a
 * {@link TaskScheduler#status()} call made after a frame observes its effect.
 * </p>
 */
class TaskSchedulerTest {

    private FakeUnitFactory units;
    private InMemoryJobStore store;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        units = new FakeUnitFactory();
        store = new InMemoryJobStore();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    // ---------------------------------------------------------------
    // Queue order
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("Queue order")
    class QueueOrder {

        @Test
        @DisplayName("Should keep the queue sorted by priority after every submission")
        void shouldSortAfterEachSubmit() {
            scheduler = start(1, OrphanPolicy.FAIL);

            submit("low-1", TaskPriority.LOW);
            assertThat(scheduler.status().getQueuedTasks()).containsExactly("low-1");

            submit("high-1", TaskPriority.HIGH);
            assertThat(scheduler.status().getQueuedTasks()).containsExactly("high-1", "low-1");

            submit("critical-1", TaskPriority.CRITICAL);
            assertThat(scheduler.status().getQueuedTasks()).containsExactly("critical-1", "high-1", "low-1");

            submit("medium-1", TaskPriority.MEDIUM);
            submit("high-2", TaskPriority.HIGH);
            assertThat(scheduler.status().getQueuedTasks())
                    .containsExactly("critical-1", "high-1", "high-2", "medium-1", "low-1");
        }

        @Test
        @DisplayName("Should dispatch a low task only after the three high tasks queued before it")
        void shouldDispatchLowAfterQueuedHighs() {
            scheduler = start(1, OrphanPolicy.FAIL);
            submit("high-1", TaskPriority.HIGH);
            submit("high-2", TaskPriority.HIGH);
            submit("high-3", TaskPriority.HIGH);
            submit("low-1", TaskPriority.LOW);

            FakeWorkerUnit unit = units.current(0);
            unit.ready();
            assertThat(scheduler.status().getActiveTasks()).containsExactly("high-1");

            for (String id : List.of("high-1", "high-2", "high-3")) {
                unit.complete(id);
                scheduler.status();
            }

            assertThat(unit.receivedIds()).containsExactly("high-1", "high-2", "high-3", "low-1");
        }

        @Test
        @DisplayName("Should queue tasks without a priority as medium")
        void shouldDefaultToMedium() {
            scheduler = start(1, OrphanPolicy.FAIL);
            scheduler.submit(Task.builder().id("no-priority").kind(TaskKind.ANALYSIS).build());
            submit("high-1", TaskPriority.HIGH);
            submit("low-1", TaskPriority.LOW);

            assertThat(scheduler.status().getQueuedTasks()).containsExactly("high-1", "no-priority", "low-1");
        }

        @Test
        @DisplayName("Should reject a task id that was already submitted")
        void shouldRejectDuplicateIds() {
            scheduler = start(1, OrphanPolicy.FAIL);
            submit("task-1", TaskPriority.HIGH);

            assertThatThrownBy(() -> submit("task-1", TaskPriority.LOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("task-1");
            assertThat(scheduler.status().getQueueLength()).isEqualTo(1);
        }
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("Should not dispatch to a unit before it reports ready")
        void shouldWaitForReady() {
            scheduler = start(1, OrphanPolicy.FAIL);
            submit("task-1", TaskPriority.HIGH);

            SchedulerStatus status = scheduler.status();
            assertThat(units.current(0).getReceived()).isEmpty();
            assertThat(status.getQueueLength()).isEqualTo(1);
            assertThat(status.isProcessing()).isTrue();
        }

        @Test
        @DisplayName("Should give each unit at most one task at a time")
        void shouldAssignOneTaskPerUnit() {
            scheduler = start(2, OrphanPolicy.FAIL);
            for (int i = 1; i <= 4; i++) {
                submit("task-" + i, TaskPriority.MEDIUM);
            }
            units.current(0).ready();
            units.current(1).ready();

            SchedulerStatus status = scheduler.status();
            assertThat(status.getWorkers()).isEqualTo(2);
            assertThat(status.getActiveWorkers()).isEqualTo(2);
            assertThat(status.getActiveTasks()).containsExactly("task-1", "task-2");
            assertThat(status.getQueuedTasks()).containsExactly("task-3", "task-4");
            assertThat(units.current(0).receivedIds()).containsExactly("task-1");
            assertThat(units.current(1).receivedIds()).containsExactly("task-2");
        }

        @Test
        @DisplayName("Should stop processing once the queue is drained")
        void shouldGoIdleWhenDrained() {
            scheduler = start(1, OrphanPolicy.FAIL);
            units.current(0).ready();
            submit("task-1", TaskPriority.HIGH);

            SchedulerStatus status = scheduler.status();
            assertThat(status.getQueueLength()).isZero();
            assertThat(status.isProcessing()).isFalse();
            assertThat(scheduler.getMetrics().getDispatched()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should return a task to the head of the queue when delivery fails and retry it")
        void shouldRequeueOnDeliveryFailure() {
            scheduler = start(1, OrphanPolicy.FAIL);
            FakeWorkerUnit unit = units.current(0);
            unit.failNextDeliveries(1);
            submit("task-1", TaskPriority.LOW);
            submit("task-2", TaskPriority.LOW);

            unit.ready();

            await().atMost(Duration.ofSeconds(5))
                    .untilAsserted(() -> assertThat(unit.receivedIds()).containsExactly("task-1"));
            assertThat(scheduler.status().getQueuedTasks()).containsExactly("task-2");
            assertThat(scheduler.getMetrics().getDeliveryRetries()).isEqualTo(1);
            assertThat(store.find("task-1")).get().extracting(TaskRecord::getStatus).isEqualTo(TaskStatus.QUEUED);
        }
    }

    // ---------------------------------------------------------------
    // Reports
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("Unit reports")
    class Reports {

        @Test
        @DisplayName("Should store progress and completion and free the unit")
        void shouldStoreProgressAndCompletion() {
            scheduler = start(1, OrphanPolicy.FAIL);
            FakeWorkerUnit unit = units.current(0);
            unit.ready();
            submit("task-1", TaskPriority.HIGH);
            unit.started("task-1");
            unit.progress("task-1", 40, "Analyzing audit logs");
            scheduler.status();

            TaskRecord running = store.find("task-1").orElseThrow();
            assertThat(running.getStatus()).isEqualTo(TaskStatus.RUNNING);
            assertThat(running.getProgress()).isEqualTo(40);

            unit.complete("task-1", Map.of("success", true, "message", "done"));
            SchedulerStatus status = scheduler.status();

            TaskRecord completed = store.find("task-1").orElseThrow();
            assertThat(completed.getStatus()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(completed.getResult()).containsEntry("message", "done");
            assertThat(status.getActiveWorkers()).isZero();
            assertThat(scheduler.getMetrics().getCompleted()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should store a failure without retrying the task")
        void shouldStoreFailureWithoutRetry() {
            scheduler = start(1, OrphanPolicy.FAIL);
            FakeWorkerUnit unit = units.current(0);
            unit.ready();
            submit("task-1", TaskPriority.HIGH);

            unit.fail("task-1", "No extraction data found");
            SchedulerStatus status = scheduler.status();

            TaskRecord failed = store.find("task-1").orElseThrow();
            assertThat(failed.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.getErrorMessage()).isEqualTo("No extraction data found");
            assertThat(failed.getErrorDetail()).isEqualTo("detail of No extraction data found");
            assertThat(status.getQueueLength()).isZero();
            assertThat(status.getActiveWorkers()).isZero();
            assertThat(unit.receivedIds()).containsExactly("task-1");
        }

        @Test
        @DisplayName("Should report 100 percent progress with the completed status")
        void shouldMapFullProgressToCompleted() {
            JobStore mockStore = mock(JobStore.class);
            scheduler = TaskScheduler.builder()
                    .poolSize(1)
                    .dispatchBackoff(Duration.ofMillis(20))
                    .unitFactory(units)
                    .jobStore(mockStore)
                    .build();
            scheduler.start();
            FakeWorkerUnit unit = units.current(0);
            unit.ready();
            scheduler.submit(task("task-1", TaskPriority.HIGH));

            unit.progress("task-1", 50, "Extracting data");
            unit.progress("task-1", 100, "Done");
            scheduler.status();

            verify(mockStore).updateProgress("task-1", 50, TaskStatus.RUNNING);
            verify(mockStore).updateProgress("task-1", 100, TaskStatus.COMPLETED);
            verify(mockStore, never()).markFailed(any(), any());
        }

        @Test
        @DisplayName("Should keep dispatching when the store throws")
        void shouldSurviveStoreFailures() {
            JobStore mockStore = mock(JobStore.class);
            doThrow(new IllegalStateException("database down"))
                    .when(mockStore).markCompleted(eq("task-1"), any());
            scheduler = TaskScheduler.builder()
                    .poolSize(1)
                    .dispatchBackoff(Duration.ofMillis(20))
                    .unitFactory(units)
                    .jobStore(mockStore)
                    .build();
            scheduler.start();
            FakeWorkerUnit unit = units.current(0);
            unit.ready();
            scheduler.submit(task("task-1", TaskPriority.HIGH));
            scheduler.submit(task("task-2", TaskPriority.HIGH));

            unit.complete("task-1");
            scheduler.status();

            assertThat(unit.receivedIds()).containsExactly("task-1", "task-2");
        }
    }

    // ---------------------------------------------------------------
    // Unit crashes
    // ---------------------------------------------------------------

    @Nested
    @DisplayName("Unit crashes")
    class Crashes {

        @Test
        @DisplayName("Should replace a crashed unit in the same slot")
        void shouldReplaceCrashedUnit() {
            scheduler = start(2, OrphanPolicy.FAIL);
            FakeWorkerUnit crashed = units.current(1);
            crashed.ready();

            crashed.crash(new IllegalStateException("boom"));
            SchedulerStatus status = scheduler.status();

            assertThat(status.getWorkers()).isEqualTo(2);
            assertThat(units.getCreated()).hasSize(3);
            assertThat(units.current(1)).isNotSameAs(crashed);
            assertThat(units.current(1).isAlive()).isTrue();
            assertThat(crashed.isTerminated()).isTrue();
            assertThat(scheduler.getMetrics().getUnitsReplaced()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail the orphaned task and reuse the slot under the FAIL policy")
        void shouldFailOrphanedTask() {
            scheduler = start(1, OrphanPolicy.FAIL);
            FakeWorkerUnit crashed = units.current(0);
            crashed.ready();
            submit("task-1", TaskPriority.HIGH);

            crashed.crash(new OutOfMemoryError("simulated"));
            SchedulerStatus status = scheduler.status();

            TaskRecord orphan = store.find("task-1").orElseThrow();
            assertThat(orphan.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(orphan.getErrorMessage()).isEqualTo("Worker 0 terminated unexpectedly");
            assertThat(orphan.getErrorDetail()).contains("simulated");
            assertThat(status.getActiveTasks()).isEmpty();

            FakeWorkerUnit replacement = units.current(0);
            replacement.ready();
            submit("task-2", TaskPriority.HIGH);
            scheduler.status();
            assertThat(replacement.receivedIds()).containsExactly("task-2");
        }

        @Test
        @DisplayName("Should leave the orphaned task registered under the ABANDON policy")
        void shouldAbandonOrphanedTask() {
            scheduler = start(1, OrphanPolicy.ABANDON);
            FakeWorkerUnit crashed = units.current(0);
            crashed.ready();
            submit("task-1", TaskPriority.HIGH);

            crashed.crash(new IllegalStateException("boom"));
            scheduler.status();
            FakeWorkerUnit replacement = units.current(0);
            assertThat(replacement).isNotSameAs(crashed);
            replacement.ready();
            submit("task-2", TaskPriority.HIGH);
            SchedulerStatus status = scheduler.status();

            assertThat(store.find("task-1")).get().extracting(TaskRecord::getStatus).isEqualTo(TaskStatus.QUEUED);
            assertThat(status.getWorkers()).isEqualTo(1);
            assertThat(status.getActiveTasks()).containsExactly("task-1");
            assertThat(status.getQueuedTasks()).containsExactly("task-2");
            assertThat(replacement.getReceived()).isEmpty();
        }

        @Test
        @DisplayName("Should ignore frames from a replaced unit")
        void shouldIgnoreStaleFrames() {
            scheduler = start(1, OrphanPolicy.ABANDON);
            FakeWorkerUnit crashed = units.current(0);
            crashed.ready();
            submit("task-1", TaskPriority.HIGH);
            crashed.crash(new IllegalStateException("boom"));

            crashed.complete("task-1");
            SchedulerStatus status = scheduler.status();

            assertThat(store.find("task-1")).get().extracting(TaskRecord::getStatus).isEqualTo(TaskStatus.QUEUED);
            assertThat(status.getActiveTasks()).containsExactly("task-1");
            assertThat(scheduler.getMetrics().getCompleted()).isZero();
        }
    }

    // ---------------------------------------------------------------
    // Shutdown
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should terminate units and abandon queued and running tasks on shutdown")
    void shouldShutDown() {
        scheduler = start(2, OrphanPolicy.FAIL);
        units.current(0).ready();
        submit("task-1", TaskPriority.HIGH);
        submit("task-2", TaskPriority.HIGH);
        submit("task-3", TaskPriority.HIGH);

        scheduler.shutdown();

        assertThat(units.getCreated()).allMatch(FakeWorkerUnit::isTerminated);
        assertThat(scheduler.status().getWorkers()).isZero();
        assertThat(scheduler.status().getQueueLength()).isZero();
        assertThat(store.find("task-1")).get().extracting(TaskRecord::getStatus).isEqualTo(TaskStatus.QUEUED);
        assertThatThrownBy(() -> submit("task-4", TaskPriority.HIGH))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should reject a submission and report stopped once the loop no longer runs")
    void shouldRejectWorkAfterLoopStopped() throws Exception {
        ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor();
        TaskScheduler stoppedLoop = TaskScheduler.builder()
                .poolSize(1)
                .dispatchBackoff(Duration.ofMillis(20))
                .unitFactory(units)
                .jobStore(store)
                .loop(loop)
                .build();
        stoppedLoop.start();
        loop.shutdown();
        assertThat(loop.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        Task task = Task.builder().id("late-1").kind(TaskKind.ANALYSIS).build();
        store.register(task);

        assertThatThrownBy(() -> stoppedLoop.submit(task))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("shut down");
        assertThat(stoppedLoop.getMetrics().getSubmitted()).isZero();
        SchedulerStatus status = stoppedLoop.status();
        assertThat(status.getWorkers()).isZero();
        assertThat(status.getQueuedTasks()).isEmpty();
        assertThat(status.isProcessing()).isFalse();
    }

    @Test
    @DisplayName("Should reject invalid builder values")
    void shouldValidateBuilder() {
        assertThatThrownBy(() -> TaskScheduler.builder().poolSize(0).unitFactory(units).jobStore(store).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("poolSize");
        assertThatThrownBy(() -> TaskScheduler.builder().jobStore(store).build())
                .isInstanceOf(NullPointerException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private TaskScheduler start(int poolSize, OrphanPolicy policy) {
        TaskScheduler s = TaskScheduler.builder()
                .poolSize(poolSize)
                .dispatchBackoff(Duration.ofMillis(20))
                .orphanPolicy(policy)
                .unitFactory(units)
                .jobStore(store)
                .build();
        s.start();
        return s;
    }

    private void submit(String id, TaskPriority priority) {
        Task task = task(id, priority);
        if (store.find(id).isEmpty()) {
            store.register(task);
        }
        scheduler.submit(task);
    }

    private static Task task(String id, TaskPriority priority) {
        return Task.builder()
                .id(id)
                .kind(TaskKind.ANALYSIS)
                .priority(priority)
                .put("extractionId", "extraction-" + id)
                .build();
    }
}
