package com.forkgate.gateway.domain;

import java.nio.charset.StandardCharsets;

/**
 * Serialized outcome of one admitted run.
 *
 * @param body the JSON document returned to the client
 * @param byteLength size of {@code body} on the wire, UTF-8 encoded
 * @param instructionsExecuted instructions the engine executed
 * @param elapsedNanos engine wall time
 */
public record ExecutionReport(
        String body, int byteLength, long instructionsExecuted, long elapsedNanos) {

    public ExecutionReport {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        if (byteLength < 0) {
            throw new IllegalArgumentException("byteLength must not be negative");
        }
    }

    /** Report for {@code body}, measuring its encoded size once. */
    public static ExecutionReport of(String body, long instructionsExecuted, long elapsedNanos) {
        if (body == null) {
            throw new IllegalArgumentException("body must not be null");
        }
        return new ExecutionReport(
                body,
                body.getBytes(StandardCharsets.UTF_8).length,
                instructionsExecuted,
                elapsedNanos);
    }
}
