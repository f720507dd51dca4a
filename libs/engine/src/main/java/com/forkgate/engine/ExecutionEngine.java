package com.forkgate.engine;

/**
 * Runs a program under an instruction and memory ceiling.
 *
 * <p>Implementations always terminate and always return a result: reaching a ceiling or hitting a
 * program fault ends the run with an error-flagged final step rather than an exception.
 */
@FunctionalInterface
public interface ExecutionEngine {

    /**
     * Runs {@code programText} against {@code input}.
     *
     * @param programText source of the program
     * @param input bytes the program may read
     * @param instructionCeiling maximum number of instructions to execute
     * @param memoryCeiling maximum number of memory cells the program may address
     * @return the trace and totals of the run
     */
    ExecutionResult run(
            String programText, byte[] input, long instructionCeiling, long memoryCeiling);
}
