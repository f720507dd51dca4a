package com.forkgate.engine;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * In-process engine for the eight-command tape language.
 *
 * <p>Commands: {@code > <} move the memory pointer, {@code + -} change the current cell (wrapping at
 * 256), {@code .} appends the current cell to the output, {@code ,} reads the next input byte (0
 * once input is exhausted), {@code [ ]} loop while the current cell is non-zero. Every other
 * character is a comment and is skipped without counting as an instruction.
 *
 * <p>One snapshot is recorded per executed instruction, up to the trace limit. The run stops with an error snapshot when
 * the brackets do not balance, when the instruction ceiling is reached, or when the memory pointer
 * leaves {@code [0, memoryCeiling)}. The tape grows lazily, so a snapshot only carries the cells the
 * program has touched.
 *
 * <p>The trace is bounded by a byte limit. Each snapshot is charged its touched cells, its output
 * and a fixed {@value #SNAPSHOT_OVERHEAD_BYTES}-byte overhead. Once a further snapshot would exceed
 * the limit, intermediate steps are no longer recorded and the result is marked truncated; the
 * final step of the run is always recorded. Totals are unaffected.
 *
 * <p>Stateless and thread-safe.
 */
public final class TapeEngine implements ExecutionEngine {

    /** Trace limit used by {@link #TapeEngine()}. */
    public static final long DEFAULT_TRACE_BYTE_LIMIT = 4L * 1024 * 1024;

    /** Fixed charge per recorded snapshot against the trace limit. */
    public static final int SNAPSHOT_OVERHEAD_BYTES = 64;

    private static final int INITIAL_TAPE = 16;

    private final long traceByteLimit;

    public TapeEngine() {
        this(DEFAULT_TRACE_BYTE_LIMIT);
    }

    /**
     * @param traceByteLimit bytes of memory and output images the recorded trace may hold
     * @throws IllegalArgumentException if the limit is not positive
     */
    public TapeEngine(long traceByteLimit) {
        if (traceByteLimit < 1) {
            throw new IllegalArgumentException("traceByteLimit must be positive");
        }
        this.traceByteLimit = traceByteLimit;
    }

    public long traceByteLimit() {
        return traceByteLimit;
    }

    @Override
    public ExecutionResult run(
            String programText, byte[] input, long instructionCeiling, long memoryCeiling) {
        long started = System.nanoTime();
        Run run = new Run(
                programText == null ? "" : programText,
                input == null ? new byte[0] : input,
                instructionCeiling,
                memoryCeiling,
                traceByteLimit);
        run.execute();
        return new ExecutionResult(
                run.steps,
                run.output.toByteArray(),
                run.executed,
                System.nanoTime() - started,
                run.truncated);
    }

    /** Mutable state of one run. */
    private static final class Run {

        private final String program;
        private final byte[] input;
        private final long instructionCeiling;
        private final long memoryCeiling;
        private final long traceByteLimit;

        private final List<StepSnapshot> steps = new ArrayList<>();
        private final ByteArrayOutputStream output = new ByteArrayOutputStream();
        private byte[] tape = new byte[INITIAL_TAPE];
        private int touched = 1;
        private int memoryPointer;
        private int instructionPointer;
        private int inputPointer;
        private long executed;
        private int[] jumps;
        private long traceBytes;
        private boolean truncated;
        private boolean lastStepRecorded;

        Run(String program,
                byte[] input,
                long instructionCeiling,
                long memoryCeiling,
                long traceByteLimit) {
            this.program = program;
            this.input = input;
            this.instructionCeiling = instructionCeiling;
            this.memoryCeiling = Math.min(memoryCeiling, Integer.MAX_VALUE - 8);
            this.traceByteLimit = traceByteLimit;
        }

        void execute() {
            String bracketError = matchBrackets();
            if (bracketError != null) {
                fail(bracketError);
                return;
            }
            while (instructionPointer < program.length()) {
                char command = program.charAt(instructionPointer);
                if (!isCommand(command)) {
                    instructionPointer++;
                    continue;
                }
                if (executed >= instructionCeiling) {
                    fail("execution limit of " + instructionCeiling + " instructions reached");
                    return;
                }
                executed++;
                if (!step(command)) {
                    return;
                }
                recordStep();
            }
            if (!lastStepRecorded && executed > 0) {
                snapshot(false, null);
            }
        }

        /** Executes one command; false when the run ended with an error. */
        private boolean step(char command) {
            switch (command) {
                case '>' -> {
                    if (memoryPointer + 1L >= memoryCeiling) {
                        fail("memory limit of " + memoryCeiling + " cells exceeded");
                        return false;
                    }
                    memoryPointer++;
                    ensureCapacity(memoryPointer);
                }
                case '<' -> {
                    if (memoryPointer == 0) {
                        fail("memory pointer moved below cell 0");
                        return false;
                    }
                    memoryPointer--;
                }
                case '+' -> tape[memoryPointer]++;
                case '-' -> tape[memoryPointer]--;
                case '.' -> output.write(tape[memoryPointer]);
                case ',' -> tape[memoryPointer] =
                        inputPointer < input.length ? input[inputPointer++] : 0;
                case '[' -> {
                    if (tape[memoryPointer] == 0) {
                        instructionPointer = jumps[instructionPointer];
                    }
                }
                case ']' -> {
                    if (tape[memoryPointer] != 0) {
                        instructionPointer = jumps[instructionPointer];
                    }
                }
                default -> throw new IllegalStateException("not a command: " + command);
            }
            instructionPointer++;
            return true;
        }

        private String matchBrackets() {
            jumps = new int[program.length()];
            Deque<Integer> open = new ArrayDeque<>();
            for (int i = 0; i < program.length(); i++) {
                char c = program.charAt(i);
                if (c == '[') {
                    open.push(i);
                } else if (c == ']') {
                    if (open.isEmpty()) {
                        return "unmatched ']' at position " + i;
                    }
                    int start = open.pop();
                    jumps[start] = i;
                    jumps[i] = start;
                }
            }
            return open.isEmpty() ? null : "unmatched '[' at position " + open.peek();
        }

        private void ensureCapacity(int index) {
            if (index >= tape.length) {
                long grown = Math.min((long) tape.length * 2, memoryCeiling);
                tape = Arrays.copyOf(tape, (int) Math.max(grown, index + 1L));
            }
            touched = Math.max(touched, index + 1);
        }

        private void fail(String message) {
            snapshot(true, message);
        }

        /** Records an intermediate step unless the trace limit has been reached. */
        private void recordStep() {
            long cost = (long) SNAPSHOT_OVERHEAD_BYTES + touched + output.size();
            if (truncated || traceBytes + cost > traceByteLimit) {
                truncated = true;
                lastStepRecorded = false;
                return;
            }
            traceBytes += cost;
            snapshot(false, null);
        }

        private void snapshot(boolean error, String message) {
            lastStepRecorded = true;
            steps.add(new StepSnapshot(
                    Arrays.copyOf(tape, touched),
                    memoryPointer,
                    instructionPointer,
                    inputPointer,
                    output.toByteArray(),
                    error,
                    message));
        }

        private static boolean isCommand(char c) {
            return switch (c) {
                case '>', '<', '+', '-', '.', ',', '[', ']' -> true;
                default -> false;
            };
        }
    }
}
