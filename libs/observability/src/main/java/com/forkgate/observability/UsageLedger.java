package com.forkgate.observability;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide aggregate usage counters.
 *
 * <p>Five independent monotonic counters, each updated atomically on its own. {@link #snapshot()}
 * reads them one after another, so under concurrent updates a snapshot may combine values from
 * different instants. The ledger is observability data and is never consulted for admission.
 *
 * <p>One instance is created at start-up and handed to every component that records usage. Counters
 * start at zero and are not persisted.
 */
public final class UsageLedger {

    private final AtomicLong requestsServed = new AtomicLong();
    private final AtomicLong instructionsExecuted = new AtomicLong();
    private final AtomicLong engineTimeNanos = new AtomicLong();
    private final AtomicLong bytesReturned = new AtomicLong();
    private final AtomicLong statusQueries = new AtomicLong();

    /** Counts one served execution request and returns the new total. */
    public long incrementRequestsServed() {
        return requestsServed.incrementAndGet();
    }

    /** Adds executed instructions and returns the new total. */
    public long addInstructionsExecuted(long instructions) {
        return instructionsExecuted.addAndGet(requireNonNegative(instructions, "instructions"));
    }

    /** Adds engine wall time in nanoseconds and returns the new total. */
    public long addEngineTimeNanos(long nanos) {
        return engineTimeNanos.addAndGet(requireNonNegative(nanos, "nanos"));
    }

    /** Adds response payload bytes and returns the new total. */
    public long addBytesReturned(long bytes) {
        return bytesReturned.addAndGet(requireNonNegative(bytes, "bytes"));
    }

    /** Counts one status query and returns the new total. */
    public long incrementStatusQueries() {
        return statusQueries.incrementAndGet();
    }

    public long requestsServed() {
        return requestsServed.get();
    }

    public long instructionsExecuted() {
        return instructionsExecuted.get();
    }

    public long engineTimeNanos() {
        return engineTimeNanos.get();
    }

    public long bytesReturned() {
        return bytesReturned.get();
    }

    public long statusQueries() {
        return statusQueries.get();
    }

    /** Current value of every counter, each read independently. */
    public UsageSnapshot snapshot() {
        return new UsageSnapshot(
                requestsServed.get(),
                instructionsExecuted.get(),
                engineTimeNanos.get(),
                bytesReturned.get(),
                statusQueries.get());
    }

    private static long requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }
}
