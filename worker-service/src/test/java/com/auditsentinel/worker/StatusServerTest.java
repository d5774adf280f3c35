package com.auditsentinel.worker;

import com.auditsentinel.worker.scheduler.FakeUnitFactory;
import com.auditsentinel.worker.scheduler.MessageCodec;
import com.auditsentinel.worker.scheduler.TaskScheduler;
import com.auditsentinel.worker.store.InMemoryJobStore;
import com.auditsentinel.worker.store.TaskStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link StatusServer} over real HTTP.
 */
class StatusServerTest {

    private final ObjectMapper mapper = MessageCodec.newObjectMapper();
    private final HttpClient http = HttpClient.newHttpClient();

    private FakeUnitFactory units;
    private InMemoryJobStore store;
    private TaskScheduler scheduler;
    private StatusServer server;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        units = new FakeUnitFactory();
        store = new InMemoryJobStore();
        scheduler = TaskScheduler.builder()
                .poolSize(2)
                .dispatchBackoff(Duration.ofMillis(20))
                .unitFactory(units)
                .jobStore(store)
                .build();
        scheduler.start();

        int port = freePort();
        server = new StatusServer(scheduler, store, mapper);
        server.start(port);
        baseUrl = "http://127.0.0.1:" + port;
    }

    @AfterEach
    void tearDown() {
        server.stop();
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Should answer health and readiness probes")
    void shouldAnswerProbes() throws Exception {
        assertThat(server.isRunning()).isTrue();
        for (String path : new String[] {"/health", "/readiness"}) {
            HttpResponse<String> response = get(path);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo("{\"status\":\"UP\"}");
        }
    }

    @Test
    @DisplayName("Should accept a task, queue it and expose its record")
    void shouldAcceptTask() throws Exception {
        HttpResponse<String> accepted = post("/tasks",
                "{\"id\":\"analysis-1\",\"kind\":\"analysis\",\"priority\":\"high\","
                        + "\"payload\":{\"extractionId\":\"ext-1\"}}");

        assertThat(accepted.statusCode()).isEqualTo(202);
        JsonNode body = mapper.readTree(accepted.body());
        assertThat(body.path("taskId").asText()).isEqualTo("analysis-1");
        assertThat(body.path("status").asText()).isEqualTo("queued");

        HttpResponse<String> record = get("/tasks/analysis-1");
        assertThat(record.statusCode()).isEqualTo(200);
        JsonNode stored = mapper.readTree(record.body());
        assertThat(stored.path("taskId").asText()).isEqualTo("analysis-1");
        assertThat(stored.path("status").asText()).isEqualTo("queued");
        assertThat(stored.path("priority").asText()).isEqualTo("high");

        JsonNode status = mapper.readTree(get("/status").body());
        assertThat(status.path("workers").asInt()).isEqualTo(2);
        assertThat(status.path("queuedTasks").get(0).asText()).isEqualTo("analysis-1");
        assertThat(status.path("isProcessing").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("Should generate an id when the submitted task has none")
    void shouldGenerateTaskId() throws Exception {
        HttpResponse<String> accepted = post("/tasks", "{\"kind\":\"extraction\"}");

        assertThat(accepted.statusCode()).isEqualTo(202);
        String taskId = mapper.readTree(accepted.body()).path("taskId").asText();
        assertThat(taskId).startsWith("extraction_");
        assertThat(store.find(taskId)).isPresent();
    }

    @Test
    @DisplayName("Should reject an invalid task body")
    void shouldRejectInvalidBody() throws Exception {
        assertThat(post("/tasks", "{not json").statusCode()).isEqualTo(400);
        assertThat(post("/tasks", "{\"id\":\"x\",\"kind\":\"mining\"}").statusCode()).isEqualTo(400);
        assertThat(post("/tasks", "{\"id\":\"x\"}").statusCode()).isEqualTo(400);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Should reject a reused task id")
    void shouldRejectReusedId() throws Exception {
        String task = "{\"id\":\"analysis-1\",\"kind\":\"analysis\"}";
        assertThat(post("/tasks", task).statusCode()).isEqualTo(202);

        HttpResponse<String> conflict = post("/tasks", task);

        assertThat(conflict.statusCode()).isEqualTo(409);
        assertThat(mapper.readTree(conflict.body()).path("error").asText()).contains("analysis-1");
        assertThat(scheduler.status().getQueuedTasks()).containsExactly("analysis-1");
    }

    @Test
    @DisplayName("Should reject a task id the scheduler already saw after its record was purged")
    void shouldRejectIdKnownToScheduler() throws Exception {
        units.current(0).ready();
        assertThat(post("/tasks", "{\"id\":\"analysis-1\",\"kind\":\"analysis\"}").statusCode()).isEqualTo(202);
        units.current(0).complete("analysis-1");
        scheduler.status();
        store.purgeTerminalBefore(Instant.now().plusSeconds(60));

        HttpResponse<String> conflict = post("/tasks", "{\"id\":\"analysis-1\",\"kind\":\"analysis\"}");

        assertThat(conflict.statusCode()).isEqualTo(409);
        assertThat(store.find("analysis-1")).get()
                .satisfies(r -> assertThat(r.getStatus()).isEqualTo(TaskStatus.FAILED));
    }

    @Test
    @DisplayName("Should answer 503 once the scheduler is shut down")
    void shouldRejectWhenStopped() throws Exception {
        scheduler.shutdown();

        HttpResponse<String> response = post("/tasks", "{\"id\":\"late\",\"kind\":\"analysis\"}");

        assertThat(response.statusCode()).isEqualTo(503);
        assertThat(store.find("late")).get()
                .satisfies(r -> assertThat(r.getStatus()).isEqualTo(TaskStatus.FAILED));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown task and 405 for unsupported methods")
    void shouldRejectUnknownAndUnsupported() throws Exception {
        HttpResponse<String> missing = get("/tasks/nope");
        assertThat(missing.statusCode()).isEqualTo(404);
        assertThat(mapper.readTree(missing.body()).path("error").asText()).isEqualTo("Unknown task: nope");

        assertThat(get("/tasks").statusCode()).isEqualTo(405);
        assertThat(post("/status", "{}").statusCode()).isEqualTo(405);
    }

    @Test
    @DisplayName("Should refuse an out-of-range port")
    void shouldValidatePort() {
        StatusServer other = new StatusServer(scheduler, store, mapper);

        assertThatThrownBy(() -> other.start(0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(other.isRunning()).isFalse();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
