package com.auditsentinel.worker.scheduler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    @Test
    @DisplayName("Should derive an id from kind and creation time when none is given")
    void shouldGenerateId() {
        Task task = Task.builder()
                .kind(TaskKind.ANALYSIS)
                .createdAt(Instant.ofEpochMilli(1_700_000_000_000L))
                .build();

        assertThat(task.getId()).startsWith("analysis_1700000000000_");
        assertThat(Task.builder().id("  ").kind(TaskKind.EXTRACTION).build().getId()).startsWith("extraction_");
    }

    @Test
    @DisplayName("Should default priority to medium and creation time to now")
    void shouldApplyDefaults() {
        Instant before = Instant.now();
        Task task = Task.builder().id("t-1").kind(TaskKind.ANALYSIS).build();

        assertThat(task.getPriority()).isEqualTo(TaskPriority.MEDIUM);
        assertThat(task.getCreatedAt()).isAfterOrEqualTo(before);
        assertThat(task.getPayload()).isEmpty();
    }

    @Test
    @DisplayName("Should copy the payload and expose it read-only")
    void shouldCopyPayload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("extractionId", "ext-1");
        Task task = Task.builder().id("t-1").kind(TaskKind.ANALYSIS).payload(payload).build();
        payload.put("extractionId", "changed");

        assertThat(task.payloadString("extractionId")).contains("ext-1");
        assertThatThrownBy(() -> task.getPayload().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should treat blank payload values as absent")
    void shouldIgnoreBlankPayloadValues() {
        Task task = Task.builder().id("t-1").kind(TaskKind.ANALYSIS)
                .put("analysisId", " ")
                .put("count", 3)
                .build();

        assertThat(task.payloadString("analysisId")).isEmpty();
        assertThat(task.payloadString("missing")).isEmpty();
        assertThat(task.payloadString("count")).contains("3");
    }

    @Test
    @DisplayName("Should require a kind")
    void shouldRequireKind() {
        assertThatThrownBy(() -> Task.builder().id("t-1").build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("kind");
    }

    @Test
    @DisplayName("Should parse priority labels case-insensitively")
    void shouldParsePriorityLabels() {
        assertThat(TaskPriority.fromLabel("Critical")).isEqualTo(TaskPriority.CRITICAL);
        assertThat(TaskPriority.fromLabel(null)).isEqualTo(TaskPriority.MEDIUM);
        assertThat(TaskPriority.fromLabel("")).isEqualTo(TaskPriority.MEDIUM);
        assertThatThrownBy(() -> TaskPriority.fromLabel("urgent"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(TaskPriority.CRITICAL.rank()).isLessThan(TaskPriority.LOW.rank());
    }

    @Test
    @DisplayName("Should compare tasks by id")
    void shouldCompareById() {
        Task a = Task.builder().id("same").kind(TaskKind.ANALYSIS).priority(TaskPriority.LOW).build();
        Task b = Task.builder().id("same").kind(TaskKind.EXTRACTION).build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }
}
