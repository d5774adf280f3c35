package com.auditsentinel.worker.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    @DisplayName("Should wrap a task in a process_task frame with lowercase labels and ISO dates")
    void shouldEncodeTaskFrame() throws Exception {
        Task task = Task.builder()
                .id("analysis_1")
                .kind(TaskKind.ANALYSIS)
                .priority(TaskPriority.HIGH)
                .put("extractionId", "ext-9")
                .createdAt(Instant.parse("2024-01-10T10:00:00Z"))
                .build();

        JsonNode frame = codec.getMapper().readTree(codec.encodeTask(task));

        assertThat(frame.path("type").asText()).isEqualTo("process_task");
        assertThat(frame.path("task").path("kind").asText()).isEqualTo("analysis");
        assertThat(frame.path("task").path("priority").asText()).isEqualTo("high");
        assertThat(frame.path("task").path("createdAt").asText()).isEqualTo("2024-01-10T10:00:00Z");
        assertThat(frame.path("task").path("payload").path("extractionId").asText()).isEqualTo("ext-9");
    }

    @Test
    @DisplayName("Should hand back a detached copy of the task")
    void shouldDecodeTaskFrame() throws Exception {
        Task task = Task.builder().id("t-1").kind(TaskKind.EXTRACTION).put("n", 1).build();

        Task decoded = codec.decodeTask(codec.encodeTask(task));

        assertThat(decoded).isEqualTo(task).isNotSameAs(task);
        assertThat(decoded.getKind()).isEqualTo(TaskKind.EXTRACTION);
        assertThat(decoded.getPriority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(decoded.getPayload()).containsEntry("n", 1);
    }

    @Test
    @DisplayName("Should reject a frame of another type")
    void shouldRejectOtherFrames() throws Exception {
        String ready = codec.encodeMessage(WorkerMessage.ready());

        assertThatThrownBy(() -> codec.decodeTask(ready))
                .isInstanceOf(MessageCodec.UnexpectedFrameException.class)
                .hasMessageContaining("ready");
    }

    @Test
    @DisplayName("Should omit fields that do not apply to a message type")
    void shouldOmitUnusedFields() throws Exception {
        JsonNode ready = codec.getMapper().readTree(codec.encodeMessage(WorkerMessage.ready()));
        JsonNode progress = codec.getMapper().readTree(
                codec.encodeMessage(WorkerMessage.progress("t-1", 40, "Analyzing audit logs")));

        assertThat(ready.size()).isEqualTo(1);
        assertThat(ready.path("type").asText()).isEqualTo("ready");
        assertThat(progress.path("type").asText()).isEqualTo("progress");
        assertThat(progress.path("percent").asInt()).isEqualTo(40);
        assertThat(progress.has("result")).isFalse();
        assertThat(progress.has("error")).isFalse();
    }

    @Test
    @DisplayName("Should carry failure details through a frame")
    void shouldDecodeFailedFrame() throws Exception {
        String frame = codec.encodeMessage(WorkerMessage.failed("t-1", new TaskError("boom", "trace")));

        WorkerMessage decoded = codec.decodeMessage(frame);

        assertThat(decoded.getType()).isEqualTo(WorkerMessage.Type.FAILED);
        assertThat(decoded.getError()).isEqualTo(new TaskError("boom", "trace"));
    }

    @Test
    @DisplayName("Should ignore unknown properties in incoming frames")
    void shouldIgnoreUnknownProperties() throws Exception {
        WorkerMessage decoded = codec.decodeMessage(
                "{\"type\":\"completed\",\"taskId\":\"t-1\",\"result\":{\"success\":true},\"extra\":1}");

        assertThat(decoded.getResult()).isEqualTo(Map.of("success", true));
    }
}
