package com.forkgate.gateway.api;

import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/v1/request_interpretation}.
 *
 * @param instructions program text
 * @param input program input, sent to the engine as UTF-8 bytes; absent means empty
 */
public record InterpretationRequest(@NotNull String instructions, String input) {}
