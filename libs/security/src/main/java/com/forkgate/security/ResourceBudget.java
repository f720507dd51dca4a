package com.forkgate.security;

/**
 * Execution limits handed to the engine for one run.
 *
 * @param instructionCeiling maximum number of instructions the engine may execute
 * @param memoryCeiling maximum number of memory cells the engine may address
 */
public record ResourceBudget(long instructionCeiling, long memoryCeiling) {

    public ResourceBudget {
        if (instructionCeiling < 1) {
            throw new IllegalArgumentException("instructionCeiling must be positive");
        }
        if (memoryCeiling < 1) {
            throw new IllegalArgumentException("memoryCeiling must be positive");
        }
    }

    /** Whether this budget is at least as large as {@code other} in both dimensions. */
    public boolean covers(ResourceBudget other) {
        return instructionCeiling >= other.instructionCeiling
                && memoryCeiling >= other.memoryCeiling;
    }
}
