package com.forkgate.gateway.domain;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forkgate.engine.ExecutionResult;
import com.forkgate.engine.StepSnapshot;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ExecutionReportWriter")
class ExecutionReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutionReportWriter writer = new ExecutionReportWriter(mapper);

    @Test
    @DisplayName("writes bytes as unsigned values and keeps snapshot order")
    void writesSnapshots() throws Exception {
        var first = new StepSnapshot(new byte[] {(byte) 255}, 0, 1, 0, new byte[0], false, null);
        var second = new StepSnapshot(
                new byte[] {(byte) 255, 7}, 1, 2, 1, new byte[] {7}, false, null);
        var result = new ExecutionResult(List.of(first, second), new byte[] {7}, 2, 1234);

        JsonNode json = mapper.readTree(writer.write(result).body());

        assertThat(json.get("snapshots")).hasSize(2);
        JsonNode last = json.get("snapshots").get(1);
        assertThat(last.get("memory").get(0).asInt()).isEqualTo(255);
        assertThat(last.get("memory_pointer").asLong()).isEqualTo(1);
        assertThat(last.get("instruction_pointer").asLong()).isEqualTo(2);
        assertThat(last.get("input_pointer").asLong()).isEqualTo(1);
        assertThat(last.get("is_error").asBoolean()).isFalse();
        assertThat(last.get("message").isNull()).isTrue();
        assertThat(json.get("output").get(0).asInt()).isEqualTo(7);
        assertThat(json.get("executions").asLong()).isEqualTo(2);
        assertThat(json.get("time").asLong()).isEqualTo(1234);
    }

    @Test
    @DisplayName("forwards engine error messages verbatim")
    void forwardsErrors() throws Exception {
        var failed = new StepSnapshot(
                new byte[1], 0, 0, 0, new byte[0], true, "memory pointer moved below cell 0");
        var result = new ExecutionResult(List.of(failed), new byte[0], 1, 10);

        JsonNode step = mapper.readTree(writer.write(result).body()).get("snapshots").get(0);

        assertThat(step.get("is_error").asBoolean()).isTrue();
        assertThat(step.get("message").asText()).isEqualTo("memory pointer moved below cell 0");
    }

    @Test
    @DisplayName("carries totals into the report")
    void carriesTotals() {
        var result = new ExecutionResult(List.of(), new byte[0], 0, 99);

        ExecutionReport report = writer.write(result);

        assertThat(report.instructionsExecuted()).isZero();
        assertThat(report.elapsedNanos()).isEqualTo(99);
        assertThat(report.body()).contains("\"snapshots\":[]");
        assertThat(report.byteLength())
                .isEqualTo(report.body().getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    @DisplayName("flags a truncated trace")
    void flagsTruncatedTrace() throws Exception {
        var last = new StepSnapshot(
                new byte[3], 2, 4, 0, new byte[0], true, "memory limit of 3 cells exceeded");
        var result = new ExecutionResult(List.of(last), new byte[0], 9, 50, true);

        JsonNode json = mapper.readTree(writer.write(result).body());

        assertThat(json.get("truncated").asBoolean()).isTrue();
        assertThat(json.get("snapshots")).hasSize(1);
        assertThat(json.get("executions").asLong()).isEqualTo(9);
    }

    @Test
    @DisplayName("marks a complete trace as not truncated")
    void completeTrace() throws Exception {
        var result = new ExecutionResult(List.of(), new byte[0], 0, 1);

        JsonNode json = mapper.readTree(writer.write(result).body());

        assertThat(json.get("truncated").asBoolean()).isFalse();
    }
}
