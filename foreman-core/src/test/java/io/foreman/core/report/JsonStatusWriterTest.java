package io.foreman.core.report;

import com.fasterxml.jackson.databind.JsonNode;
import io.foreman.api.health.HealthReport;
import io.foreman.api.health.HealthStatus;
import io.foreman.api.metrics.PoolMetrics;
import io.foreman.api.metrics.WorkflowRecord;
import io.foreman.api.report.StatusReport;
import io.foreman.api.resilience.CircuitBreakerMetrics;
import io.foreman.api.resilience.CircuitState;
import io.foreman.api.workflow.WorkflowPhase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonStatusWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldDeriveStreamFileName() {
        assertThat(JsonStatusWriter.streamPathFor(tempDir.resolve("status.json")).getFileName().toString())
                .isEqualTo("status-stream.jsonl");
        assertThat(JsonStatusWriter.streamPathFor(tempDir.resolve("status")).getFileName().toString())
                .isEqualTo("status-stream.jsonl");
    }

    @Test
    void shouldWriteStatusReportAsJson() throws IOException {
        Path file = tempDir.resolve("status.json");
        Instant now = Instant.parse("2024-01-01T12:00:00Z");
        StatusReport report = new StatusReport(
                now,
                PoolMetrics.builder().poolSize(4).activeCount(1).utilizationPct(25).build(),
                new HealthReport(HealthStatus.HEALTHY, List.of(), Map.of("queue_depth", 0), List.of()),
                List.of(),
                List.of(new CircuitBreakerMetrics("workflow", CircuitState.CLOSED, 0, 0, 0.0, 0)));

        try (var writer = new JsonStatusWriter(file)) {
            writer.writeStatus(report);
            JsonNode json = writer.objectMapper().readTree(file.toFile());

            assertThat(json.get("capturedAt").asText()).isEqualTo("2024-01-01T12:00:00Z");
            assertThat(json.get("metrics").get("poolSize").asInt()).isEqualTo(4);
            assertThat(json.get("health").get("status").asText()).isEqualTo("HEALTHY");
            assertThat(json.get("circuitBreakers").get(0).get("state").asText()).isEqualTo("CLOSED");
        }
    }

    @Test
    void shouldAppendRecordsAsJsonLines() throws IOException {
        Path file = tempDir.resolve("status.json");
        try (var writer = new JsonStatusWriter(file)) {
            Instant now = Instant.parse("2024-01-01T12:00:00Z");
            writer.writeRecord(new WorkflowRecord("t1", 120.5, true, WorkflowPhase.COMPLETE, 0, now));
            writer.writeRecord(new WorkflowRecord("t2", 80.0, false, null, 3, now));
        }

        List<String> lines = Files.readAllLines(tempDir.resolve("status-stream.jsonl"));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("\"workflowId\":\"t1\"").contains("\"phase\":\"COMPLETE\"");
        assertThat(lines.get(1)).contains("\"retryCount\":3");
    }
}
