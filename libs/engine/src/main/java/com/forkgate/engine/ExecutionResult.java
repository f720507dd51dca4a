package com.forkgate.engine;

import java.util.List;
import java.util.Optional;

/**
 * Everything an engine run produced.
 *
 * @param steps ordered per-step snapshots
 * @param output final output bytes
 * @param instructionsExecuted number of instructions executed
 * @param elapsedNanos wall time spent inside the engine
 * @param truncated whether intermediate steps were left out of {@code steps} to bound its size
 */
public record ExecutionResult(
        List<StepSnapshot> steps,
        byte[] output,
        long instructionsExecuted,
        long elapsedNanos,
        boolean truncated) {

    public ExecutionResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
        output = output == null ? new byte[0] : output.clone();
        if (instructionsExecuted < 0) {
            throw new IllegalArgumentException("instructionsExecuted must not be negative");
        }
        if (elapsedNanos < 0) {
            throw new IllegalArgumentException("elapsedNanos must not be negative");
        }
    }

    /** Result carrying every step. */
    public ExecutionResult(
            List<StepSnapshot> steps, byte[] output, long instructionsExecuted, long elapsedNanos) {
        this(steps, output, instructionsExecuted, elapsedNanos, false);
    }

    @Override
    public byte[] output() {
        return output.clone();
    }

    /** The error step that ended the run, if it ended abnormally. */
    public Optional<StepSnapshot> failure() {
        return steps.stream().filter(StepSnapshot::error).findFirst();
    }
}
