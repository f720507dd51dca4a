package com.forkgate.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("UsageLedgerMetrics")
class UsageLedgerMetricsTest {

    private SimpleMeterRegistry registry;
    private UsageLedger ledger;
    private UsageLedgerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        ledger = new UsageLedger();
        metrics = new UsageLedgerMetrics(registry, "gateway-test");
        metrics.bind(ledger);
    }

    @Test
    @DisplayName("function counters follow the ledger")
    void countersFollowLedger() {
        ledger.addInstructionsExecuted(120);
        ledger.incrementRequestsServed();

        FunctionCounter instructions =
                registry.get("forkgate.ledger.instructions.executed").functionCounter();
        FunctionCounter requests = registry.get("forkgate.ledger.requests.served").functionCounter();

        assertThat(instructions.count()).isEqualTo(120.0);
        assertThat(requests.count()).isEqualTo(1.0);
        assertThat(instructions.getId().getTag(UsageLedgerMetrics.TAG_SERVICE))
                .isEqualTo("gateway-test");
    }

    @Test
    @DisplayName("all five counters are registered")
    void allCountersRegistered() {
        assertThat(registry.find("forkgate.ledger.engine.time").functionCounter()).isNotNull();
        assertThat(registry.find("forkgate.ledger.bytes.returned").functionCounter()).isNotNull();
        assertThat(registry.find("forkgate.ledger.status.queries").functionCounter()).isNotNull();
    }

    @Test
    @DisplayName("engine run timer is tagged by tier")
    void engineRunTimerTagged() {
        Timer timer = metrics.engineRunTimer("basic");
        timer.record(Duration.ofMillis(3));

        assertThat(registry.get(UsageLedgerMetrics.ENGINE_RUN_TIMER).tag("tier", "basic").timer()
                        .count())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("rejects null registry and blank service name")
    void rejectsBadArguments() {
        assertThatThrownBy(() -> new UsageLedgerMetrics(null, "svc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
        assertThatThrownBy(() -> new UsageLedgerMetrics(registry, " "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("serviceName");
    }
}
