package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link WorkerUnit} backed by a dedicated daemon thread and a one-slot
 * mailbox.
 *
 * <h3>Isolation</h3>
 * <p>
 * Tasks arrive as encoded {@code process_task} frames and every report
 * leaves as an encoded {@link WorkerMessage} frame, so the unit and the
 * scheduler share no mutable objects. Each unit owns its own handler
 * instances.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * A handler {@link Exception} is reported as {@code failed} and the unit
 * keeps running. Anything else escaping the unit thread ends it and is
 * reported through {@link UnitListener#onCrash}, unless the unit was
 * terminated.
 * </p>
 *
 * @since 1.0.0
 */
public class ThreadWorkerUnit implements WorkerUnit {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadWorkerUnit.class);

    private final int slot;
    private final Map<TaskKind, TaskHandler> handlers;
    private final MessageCodec codec;
    private final UnitListener listener;
    private final BlockingQueue<String> mailbox = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private volatile Thread thread;

    /**
     * @param slot     pool slot index
     * @param handlers handlers for this unit, at most one per kind
     * @param codec    frame codec
     * @param listener receiver of the unit's frames
     * @throws IllegalArgumentException if two handlers share a kind
     */
    public ThreadWorkerUnit(int slot, List<TaskHandler> handlers, MessageCodec codec, UnitListener listener) {
        this.slot = slot;
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.handlers = new EnumMap<>(TaskKind.class);
        for (TaskHandler handler : Objects.requireNonNull(handlers, "handlers must not be null")) {
            if (this.handlers.put(handler.kind(), handler) != null) {
                throw new IllegalArgumentException("Duplicate handler for task kind: " + handler.kind().getLabel());
            }
        }
    }

    /**
     * Factory creating one unit per slot, each with freshly supplied handlers.
     *
     * @param handlers supplier called once per created unit
     * @param codec    frame codec shared by all units
     * @return the factory
     */
    public static WorkerUnitFactory factory(Supplier<List<TaskHandler>> handlers, MessageCodec codec) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        Objects.requireNonNull(codec, "codec must not be null");
        return (slot, listener) -> new ThreadWorkerUnit(slot, handlers.get(), codec, listener);
    }

    // ---------------------------------------------------------------
    // WorkerUnit
    // ---------------------------------------------------------------

    @Override
    public int getSlot() {
        return slot;
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Worker unit " + slot + " already started");
        }
        thread = new Thread(this::run, "worker-unit-" + slot);
        thread.setDaemon(true);
        thread.start();
    }

    @Override
    public void send(Task task) throws TaskDeliveryException {
        Objects.requireNonNull(task, "task must not be null");
        if (!isAlive()) {
            throw new TaskDeliveryException("Worker unit " + slot + " is not running");
        }
        String frame;
        try {
            frame = codec.encodeTask(task);
        } catch (JsonProcessingException e) {
            throw new TaskDeliveryException("Failed to encode task " + task.getId(), e);
        }
        if (!mailbox.offer(frame)) {
            throw new TaskDeliveryException("Worker unit " + slot + " is busy");
        }
    }

    @Override
    public void terminate() {
        if (terminated.compareAndSet(false, true)) {
            Thread t = thread;
            if (t != null) {
                t.interrupt();
            }
            LOG.debug("Worker unit {} terminated", slot);
        }
    }

    @Override
    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive() && !terminated.get();
    }

    // ---------------------------------------------------------------
    // Unit thread
    // ---------------------------------------------------------------

    private void run() {
        try {
            post(WorkerMessage.ready());
            LOG.debug("Worker unit {} ready for tasks", slot);
            while (!terminated.get()) {
                process(mailbox.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            if (!terminated.get()) {
                LOG.error("Worker unit {} died: {}", slot, e.toString(), e);
                listener.onCrash(this, e);
            }
        }
    }

    private void process(String frame) {
        Task task;
        try {
            task = codec.decodeTask(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Worker unit " + slot + " received an unreadable frame", e);
        }
        String taskId = task.getId();
        post(WorkerMessage.started(taskId));
        LOG.info("Worker unit {} processing task {} ({})", slot, taskId, task.getKind().getLabel());

        Map<String, Object> result;
        try {
            TaskHandler handler = handlers.get(task.getKind());
            if (handler == null) {
                throw new IllegalArgumentException("Unknown task kind: " + task.getKind().getLabel());
            }
            result = handler.handle(task, (percent, message) -> post(WorkerMessage.progress(taskId, percent, message)));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (terminated.get()) {
                LOG.debug("Worker unit {} abandoned task {} on termination", slot, taskId);
                return;
            }
            LOG.error("Worker unit {} failed task {}: {}", slot, taskId, e.getMessage(), e);
            post(WorkerMessage.failed(taskId, TaskError.of(e)));
            return;
        }

        String completed;
        try {
            completed = codec.encodeMessage(WorkerMessage.completed(taskId, result));
        } catch (JsonProcessingException e) {
            LOG.error("Worker unit {} could not encode the result of task {}: {}", slot, taskId, e.getMessage(), e);
            post(WorkerMessage.failed(taskId, TaskError.of(e)));
            return;
        }
        if (!terminated.get()) {
            listener.onFrame(this, completed);
        }
    }

    private void post(WorkerMessage message) {
        if (terminated.get()) {
            return;
        }
        try {
            listener.onFrame(this, codec.encodeMessage(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message, e);
        }
    }

    @Override
    public String toString() {
        return "ThreadWorkerUnit{slot=" + slot + ", alive=" + isAlive() + '}';
    }
}
