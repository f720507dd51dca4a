package com.forkgate.observability;

import java.util.Locale;

/**
 * Point-in-time copy of the {@link UsageLedger} counters.
 *
 * @param requestsServed execution requests answered
 * @param instructionsExecuted engine instructions executed across all runs
 * @param engineTimeNanos engine wall time across all runs
 * @param bytesReturned execution response payload bytes
 * @param statusQueries status endpoint hits
 */
public record UsageSnapshot(
        long requestsServed,
        long instructionsExecuted,
        long engineTimeNanos,
        long bytesReturned,
        long statusQueries) {

    /** Plain-text rendering served by the status endpoint, one counter per line. */
    public String toPlainText() {
        return String.format(
                Locale.ROOT,
                "requests served: %d%n"
                        + "instructions executed: %d%n"
                        + "engine time: %.2f ms%n"
                        + "bytes returned: %d%n"
                        + "status queries: %d%n",
                requestsServed,
                instructionsExecuted,
                engineTimeNanos / 1_000_000.0,
                bytesReturned,
                statusQueries);
    }
}
