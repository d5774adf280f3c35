package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted {@link WorkerUnit}: records what it receives and posts frames
 * only when the test tells it to.
 */
public final class FakeWorkerUnit implements WorkerUnit {

    private final int slot;
    private final UnitListener listener;
    private final MessageCodec codec = new MessageCodec();
    private final List<Task> received = new CopyOnWriteArrayList<>();
    private final AtomicInteger deliveryFailures = new AtomicInteger();

    private volatile boolean started;
    private volatile boolean terminated;

    FakeWorkerUnit(int slot, UnitListener listener) {
        this.slot = slot;
        this.listener = listener;
    }

    @Override
    public int getSlot() {
        return slot;
    }

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void send(Task task) throws TaskDeliveryException {
        if (deliveryFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TaskDeliveryException("Simulated delivery failure to unit " + slot);
        }
        received.add(task);
    }

    @Override
    public void terminate() {
        terminated = true;
    }

    @Override
    public boolean isAlive() {
        return started && !terminated;
    }

    // ---------------------------------------------------------------
    // Scripting
    // ---------------------------------------------------------------

    public void failNextDeliveries(int count) {
        deliveryFailures.set(count);
    }

    public void ready() {
        post(WorkerMessage.ready());
    }

    public void started(String taskId) {
        post(WorkerMessage.started(taskId));
    }

    public void progress(String taskId, int percent, String message) {
        post(WorkerMessage.progress(taskId, percent, message));
    }

    public void complete(String taskId) {
        complete(taskId, Map.of("success", true));
    }

    public void complete(String taskId, Map<String, Object> result) {
        post(WorkerMessage.completed(taskId, result));
    }

    public void fail(String taskId, String message) {
        post(WorkerMessage.failed(taskId, new TaskError(message, "detail of " + message)));
    }

    public void crash(Throwable cause) {
        listener.onCrash(this, cause);
    }

    public List<Task> getReceived() {
        return received;
    }

    public List<String> receivedIds() {
        return received.stream().map(Task::getId).toList();
    }

    public boolean isTerminated() {
        return terminated;
    }

    private void post(WorkerMessage message) {
        try {
            listener.onFrame(this, codec.encodeMessage(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
