package com.auditsentinel.worker;

import com.auditsentinel.worker.scheduler.Task;
import com.auditsentinel.worker.scheduler.TaskError;
import com.auditsentinel.worker.scheduler.TaskScheduler;
import com.auditsentinel.worker.store.JobStore;
import com.auditsentinel.worker.store.TaskRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server for probes, task submission and status.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code 200} with {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – same; readiness probe target</li>
 * <li>{@code GET /status} – scheduler snapshot</li>
 * <li>{@code POST /tasks} – register and submit a task; {@code 202} with the
 * task id, {@code 400} for an invalid body, {@code 409} for a reused id</li>
 * <li>{@code GET /tasks/{id}} – stored task record, or {@code 404}</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final String TASKS_PATH = "/tasks";

    private final TaskScheduler scheduler;
    private final JobStore jobStore;
    private final ObjectMapper mapper;

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public StatusServer(TaskScheduler scheduler, JobStore jobStore, ObjectMapper mapper) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; must be in range [1, 65535]
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [1, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", StatusServer::handleHealthCheck);
            server.createContext("/readiness", StatusServer::handleHealthCheck);
            server.createContext("/status", this::handleStatus);
            server.createContext(TASKS_PATH, this::handleTasks);

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", port);
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Status server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, HEALTH_RESPONSE.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(HEALTH_RESPONSE);
        }
    }

    private void handleStatus(HttpExchange exchange) throws IOException {
        if (!"GET".equals(exchange.getRequestMethod())) {
            respond(exchange, 405, error("Method not allowed"));
            return;
        }
        respond(exchange, 200, scheduler.status());
    }

    private void handleTasks(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        String method = exchange.getRequestMethod();
        if (path.equals(TASKS_PATH) || path.equals(TASKS_PATH + "/")) {
            if ("POST".equals(method)) {
                submitTask(exchange);
            } else {
                respond(exchange, 405, error("Method not allowed"));
            }
            return;
        }
        if (!"GET".equals(method)) {
            respond(exchange, 405, error("Method not allowed"));
            return;
        }
        String taskId = path.substring(TASKS_PATH.length() + 1);
        Optional<TaskRecord> record = jobStore.find(taskId);
        if (record.isPresent()) {
            respond(exchange, 200, record.get());
        } else {
            respond(exchange, 404, error("Unknown task: " + taskId));
        }
    }

    private void submitTask(HttpExchange exchange) throws IOException {
        Task task;
        try (InputStream body = exchange.getRequestBody()) {
            task = mapper.readValue(body, Task.class);
        } catch (JsonProcessingException e) {
            respond(exchange, 400, error("Invalid task: " + e.getOriginalMessage()));
            return;
        }

        try {
            jobStore.register(task);
        } catch (IllegalArgumentException e) {
            respond(exchange, 409, error(e.getMessage()));
            return;
        }
        try {
            scheduler.submit(task);
        } catch (IllegalArgumentException e) {
            jobStore.markFailed(task.getId(), new TaskError(e.getMessage(), null));
            respond(exchange, 409, error(e.getMessage()));
            return;
        } catch (IllegalStateException e) {
            jobStore.markFailed(task.getId(), new TaskError(e.getMessage(), null));
            respond(exchange, 503, error(e.getMessage()));
            return;
        }

        Map<String, Object> accepted = new LinkedHashMap<>();
        accepted.put("taskId", task.getId());
        accepted.put("status", "queued");
        respond(exchange, 202, accepted);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void respond(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, Object> error(String message) {
        return Map.of("error", message != null ? message : "Unknown error");
    }
}
