package com.forkgate.engine;

/**
 * Engine state after one step of a run.
 *
 * @param memory memory image, one unsigned byte per cell
 * @param memoryPointer index of the current memory cell
 * @param instructionPointer index of the next instruction in the program text
 * @param inputPointer index of the next unread input byte
 * @param output everything the program has written so far
 * @param error whether the run stopped with an error at this step
 * @param message error description, null when {@code error} is false
 */
public record StepSnapshot(
        byte[] memory,
        long memoryPointer,
        long instructionPointer,
        long inputPointer,
        byte[] output,
        boolean error,
        String message) {

    public StepSnapshot {
        memory = memory == null ? new byte[0] : memory.clone();
        output = output == null ? new byte[0] : output.clone();
    }

    @Override
    public byte[] memory() {
        return memory.clone();
    }

    @Override
    public byte[] output() {
        return output.clone();
    }
}
