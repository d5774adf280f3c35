package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ThreadWorkerUnitTest {

    private final MessageCodec codec = new MessageCodec();
    private final RecordingListener listener = new RecordingListener();
    private ThreadWorkerUnit unit;

    @AfterEach
    void tearDown() {
        if (unit != null) {
            unit.terminate();
        }
    }

    @Test
    @DisplayName("Should report ready once started")
    void shouldReportReady() {
        unit = new ThreadWorkerUnit(3, List.of(), codec, listener);
        unit.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.READY));
        assertThat(unit.isAlive()).isTrue();
        assertThat(unit.getSlot()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should report started, progress and completed for a successful task")
    void shouldRunTask() throws Exception {
        TaskHandler handler = new StubHandler(TaskKind.EXTRACTION, (task, progress) -> {
            progress.report(50, "half way");
            return Map.of("success", true, "echo", task.getPayload().get("value"));
        });
        unit = start(List.of(handler));

        unit.send(task("task-1", TaskKind.EXTRACTION));

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.COMPLETED));
        assertThat(listener.types()).containsExactly(
                WorkerMessage.Type.READY,
                WorkerMessage.Type.STARTED,
                WorkerMessage.Type.PROGRESS,
                WorkerMessage.Type.COMPLETED);
        WorkerMessage progress = listener.messages().get(2);
        assertThat(progress.getPercent()).isEqualTo(50);
        assertThat(progress.getMessage()).isEqualTo("half way");
        WorkerMessage completed = listener.messages().get(3);
        assertThat(completed.getTaskId()).isEqualTo("task-1");
        assertThat(completed.getResult()).containsEntry("echo", "payload-task-1");
    }

    @Test
    @DisplayName("Should report a handler exception as failed and keep running")
    void shouldReportHandlerFailure() throws Exception {
        TaskHandler handler = new StubHandler(TaskKind.ANALYSIS, (task, progress) -> {
            if (task.getId().equals("bad")) {
                throw new IllegalStateException("No extraction data found");
            }
            return Map.of("success", true);
        });
        unit = start(List.of(handler));

        unit.send(task("bad", TaskKind.ANALYSIS));
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.FAILED));

        WorkerMessage failed = listener.last();
        assertThat(failed.getTaskId()).isEqualTo("bad");
        assertThat(failed.getError().getMessage()).isEqualTo("No extraction data found");
        assertThat(failed.getError().getDetail()).contains("IllegalStateException");

        unit.send(task("good", TaskKind.ANALYSIS));
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.COMPLETED));
        assertThat(unit.isAlive()).isTrue();
        assertThat(listener.crashes).isEmpty();
    }

    @Test
    @DisplayName("Should fail a task whose kind has no handler")
    void shouldFailUnknownKind() throws Exception {
        unit = start(List.of(new StubHandler(TaskKind.ANALYSIS, (task, progress) -> Map.of())));

        unit.send(task("task-1", TaskKind.EXTRACTION));

        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.FAILED));
        assertThat(listener.last().getError().getMessage()).isEqualTo("Unknown task kind: extraction");
    }

    @Test
    @DisplayName("Should report a crash when an error escapes the handler")
    void shouldReportCrash() throws Exception {
        unit = start(List.of(new StubHandler(TaskKind.ANALYSIS, (task, progress) -> {
            throw new StackOverflowError("simulated");
        })));

        unit.send(task("task-1", TaskKind.ANALYSIS));

        await().atMost(Duration.ofSeconds(5)).until(() -> !listener.crashes.isEmpty());
        assertThat(listener.crashes.get(0)).isInstanceOf(StackOverflowError.class);
        await().atMost(Duration.ofSeconds(5)).until(() -> !unit.isAlive());
        assertThat(listener.types()).doesNotContain(WorkerMessage.Type.FAILED);
    }

    @Test
    @DisplayName("Should refuse delivery before start and while busy")
    void shouldRefuseDelivery() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        unit = new ThreadWorkerUnit(0, List.of(new StubHandler(TaskKind.ANALYSIS, (task, progress) -> {
            release.await(5, TimeUnit.SECONDS);
            return Map.of();
        })), codec, listener);

        assertThatThrownBy(() -> unit.send(task("early", TaskKind.ANALYSIS)))
                .isInstanceOf(TaskDeliveryException.class)
                .hasMessageContaining("not running");

        unit.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.READY));
        unit.send(task("first", TaskKind.ANALYSIS));
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.STARTED));
        unit.send(task("second", TaskKind.ANALYSIS));

        assertThatThrownBy(() -> unit.send(task("third", TaskKind.ANALYSIS)))
                .isInstanceOf(TaskDeliveryException.class)
                .hasMessageContaining("busy");
        release.countDown();
    }

    @Test
    @DisplayName("Should post nothing about a task running when the unit is terminated")
    void shouldStaySilentAfterTerminate() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        unit = start(List.of(new StubHandler(TaskKind.EXTRACTION, (task, progress) -> {
            entered.countDown();
            Thread.sleep(10_000);
            return Map.of();
        })));

        unit.send(task("task-1", TaskKind.EXTRACTION));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        unit.terminate();

        await().atMost(Duration.ofSeconds(5)).until(() -> !unit.isAlive());
        assertThat(listener.types()).containsExactly(WorkerMessage.Type.READY, WorkerMessage.Type.STARTED);
        assertThat(listener.crashes).isEmpty();
    }

    @Test
    @DisplayName("Should reject two handlers for the same kind")
    void shouldRejectDuplicateKinds() {
        List<TaskHandler> handlers = List.of(
                new StubHandler(TaskKind.ANALYSIS, (task, progress) -> Map.of()),
                new StubHandler(TaskKind.ANALYSIS, (task, progress) -> Map.of()));

        assertThatThrownBy(() -> new ThreadWorkerUnit(0, handlers, codec, listener))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analysis");
    }

    @Test
    @DisplayName("Should give every unit created by the factory its own handlers")
    void shouldSupplyHandlersPerUnit() {
        List<TaskHandler> supplied = new CopyOnWriteArrayList<>();
        WorkerUnitFactory factory = ThreadWorkerUnit.factory(() -> {
            TaskHandler handler = new StubHandler(TaskKind.ANALYSIS, (task, progress) -> Map.of());
            supplied.add(handler);
            return List.of(handler);
        }, codec);

        WorkerUnit first = factory.create(0, listener);
        WorkerUnit second = factory.create(1, listener);

        assertThat(supplied).hasSize(2);
        assertThat(supplied.get(0)).isNotSameAs(supplied.get(1));
        assertThat(first.getSlot()).isZero();
        assertThat(second.getSlot()).isEqualTo(1);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private ThreadWorkerUnit start(List<TaskHandler> handlers) {
        ThreadWorkerUnit u = new ThreadWorkerUnit(0, handlers, codec, listener);
        u.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> listener.types().contains(WorkerMessage.Type.READY));
        return u;
    }

    private static Task task(String id, TaskKind kind) {
        return Task.builder().id(id).kind(kind).put("value", "payload-" + id).build();
    }

    @FunctionalInterface
    private interface Body {
        Map<String, Object> run(Task task, ProgressReporter progress) throws Exception;
    }

    private static final class StubHandler implements TaskHandler {
        private final TaskKind kind;
        private final Body body;

        StubHandler(TaskKind kind, Body body) {
            this.kind = kind;
            this.body = body;
        }

        @Override
        public TaskKind kind() {
            return kind;
        }

        @Override
        public Map<String, Object> handle(Task task, ProgressReporter progress) throws Exception {
            return body.run(task, progress);
        }
    }

    private final class RecordingListener implements UnitListener {
        private final List<String> frames = new CopyOnWriteArrayList<>();
        private final List<Throwable> crashes = new CopyOnWriteArrayList<>();

        @Override
        public void onFrame(WorkerUnit unit, String frame) {
            frames.add(frame);
        }

        @Override
        public void onCrash(WorkerUnit unit, Throwable cause) {
            crashes.add(cause);
        }

        List<WorkerMessage> messages() {
            return frames.stream().map(this::decode).toList();
        }

        List<WorkerMessage.Type> types() {
            return messages().stream().map(WorkerMessage::getType).toList();
        }

        WorkerMessage last() {
            List<WorkerMessage> all = messages();
            return all.get(all.size() - 1);
        }

        private WorkerMessage decode(String frame) {
            try {
                return codec.decodeMessage(frame);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException(e);
            }
        }
    }
}
