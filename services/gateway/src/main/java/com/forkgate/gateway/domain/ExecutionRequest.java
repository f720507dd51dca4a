package com.forkgate.gateway.domain;

import java.nio.charset.StandardCharsets;

/**
 * A program and the input it may read.
 *
 * @param programText program source handed to the engine unchanged
 * @param input input bytes
 */
public record ExecutionRequest(String programText, byte[] input) {

    public ExecutionRequest {
        if (programText == null) {
            throw new IllegalArgumentException("programText must not be null");
        }
        input = input == null ? new byte[0] : input.clone();
    }

    /** Request whose input is the UTF-8 encoding of {@code input}. */
    public static ExecutionRequest of(String programText, String input) {
        return new ExecutionRequest(
                programText, input == null ? null : input.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] input() {
        return input.clone();
    }
}
