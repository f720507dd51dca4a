package com.forkgate.gateway.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.forkgate.engine.ExecutionResult;
import com.forkgate.engine.StepSnapshot;

/**
 * Renders an {@link ExecutionResult} as the JSON document clients receive.
 *
 * <pre>
 * {
 *   "snapshots": [
 *     { "memory": [72, 0], "memory_pointer": 0, "instruction_pointer": 3,
 *       "input_pointer": 0, "output": [], "is_error": false, "message": null }
 *   ],
 *   "output": [72],
 *   "executions": 73,
 *   "time": 51234,
 *   "truncated": false
 * }
 * </pre>
 *
 * <p>Byte sequences are written as arrays of unsigned values. {@code time} is in nanoseconds.
 * {@code truncated} is true when the engine stopped recording intermediate snapshots; the last
 * snapshot is still the final step of the run.
 * Engine error messages are copied verbatim.
 */
public final class ExecutionReportWriter {

    private final ObjectMapper objectMapper;

    public ExecutionReportWriter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper must not be null");
        }
        this.objectMapper = objectMapper;
    }

    public ExecutionReport write(ExecutionResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode snapshots = root.putArray("snapshots");
        for (StepSnapshot step : result.steps()) {
            ObjectNode node = snapshots.addObject();
            writeBytes(node.putArray("memory"), step.memory());
            node.put("memory_pointer", step.memoryPointer());
            node.put("instruction_pointer", step.instructionPointer());
            node.put("input_pointer", step.inputPointer());
            writeBytes(node.putArray("output"), step.output());
            node.put("is_error", step.error());
            node.put("message", step.message());
        }
        writeBytes(root.putArray("output"), result.output());
        root.put("executions", result.instructionsExecuted());
        root.put("time", result.elapsedNanos());
        root.put("truncated", result.truncated());

        try {
            return ExecutionReport.of(
                    objectMapper.writeValueAsString(root),
                    result.instructionsExecuted(),
                    result.elapsedNanos());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution result", e);
        }
    }

    private static void writeBytes(ArrayNode target, byte[] bytes) {
        for (byte b : bytes) {
            target.add(Byte.toUnsignedInt(b));
        }
    }
}
