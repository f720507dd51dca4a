package com.forkgate.observability;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.util.function.ToDoubleFunction;

/**
 * Publishes a {@link UsageLedger} to Micrometer.
 *
 * <p>The ledger stays the source of truth; the registered {@link FunctionCounter}s read it on each
 * scrape, so {@code /actuator/prometheus} and the status endpoint never disagree. Every meter carries
 * a {@code service} tag.
 */
public final class UsageLedgerMetrics {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Prefix shared by all ledger meters. */
    public static final String PREFIX = "forkgate.ledger.";

    /** Timer recording engine wall time per run, tagged by tier. */
    public static final String ENGINE_RUN_TIMER = "forkgate.engine.run";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry the Micrometer meter registry (e.g. PrometheusMeterRegistry)
     * @param serviceName logical service name included as a default tag
     */
    public UsageLedgerMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Registers one function counter per ledger counter. */
    public void bind(UsageLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        register(ledger, "requests.served", "Execution requests answered",
                UsageLedger::requestsServed, null);
        register(ledger, "instructions.executed", "Engine instructions executed",
                UsageLedger::instructionsExecuted, null);
        register(ledger, "engine.time", "Engine wall time",
                UsageLedger::engineTimeNanos, "nanoseconds");
        register(ledger, "bytes.returned", "Execution response bytes returned",
                UsageLedger::bytesReturned, "bytes");
        register(ledger, "status.queries", "Status endpoint queries",
                UsageLedger::statusQueries, null);
    }

    /**
     * Timer for engine runs of one tier.
     *
     * @param tier wire name of the tier the run was admitted under
     */
    public Timer engineRunTimer(String tier) {
        return Timer.builder(ENGINE_RUN_TIMER)
                .description("Engine wall time per run")
                .tags(baseTags().and("tier", tier))
                .register(registry);
    }

    private void register(
            UsageLedger ledger,
            String name,
            String description,
            ToDoubleFunction<UsageLedger> reader,
            String baseUnit) {
        FunctionCounter.builder(PREFIX + name, ledger, reader)
                .description(description)
                .baseUnit(baseUnit)
                .tags(baseTags())
                .register(registry);
    }

    private Tags baseTags() {
        return Tags.of(TAG_SERVICE, serviceName);
    }
}
