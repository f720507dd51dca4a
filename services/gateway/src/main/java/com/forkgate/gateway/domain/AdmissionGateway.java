package com.forkgate.gateway.domain;

import com.forkgate.engine.ExecutionEngine;
import com.forkgate.engine.ExecutionResult;
import com.forkgate.observability.SpanHelper;
import com.forkgate.observability.UsageLedger;
import com.forkgate.observability.UsageLedgerMetrics;
import com.forkgate.security.ResourceBudget;
import com.forkgate.security.Tier;
import com.forkgate.security.TierPolicy;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs admitted requests under their tier's budget and meters them.
 *
 * <p>Callers resolve the tier first; a rejected request never reaches this class and so never
 * touches the ledger. Each run invokes the engine exactly once. Instruction count and engine time
 * are recorded as soon as the engine returns; bytes returned and the served-request count follow
 * once the response body exists.
 */
public class AdmissionGateway {

    private static final Logger log = LoggerFactory.getLogger(AdmissionGateway.class);

    private final TierPolicy tierPolicy;
    private final ExecutionEngine engine;
    private final UsageLedger ledger;
    private final UsageLedgerMetrics metrics;
    private final ExecutionReportWriter reportWriter;
    private final SpanHelper spanHelper;

    public AdmissionGateway(
            TierPolicy tierPolicy,
            ExecutionEngine engine,
            UsageLedger ledger,
            UsageLedgerMetrics metrics,
            ExecutionReportWriter reportWriter,
            SpanHelper spanHelper) {
        this.tierPolicy = tierPolicy;
        this.engine = engine;
        this.ledger = ledger;
        this.metrics = metrics;
        this.reportWriter = reportWriter;
        this.spanHelper = spanHelper;
    }

    /**
     * Runs {@code request} under the budget of {@code tier}.
     *
     * @param request program and input
     * @param tier the caller's resolved tier
     * @return the serialized result
     */
    public ExecutionReport handle(ExecutionRequest request, Tier tier) {
        ResourceBudget budget = tierPolicy.budgetFor(tier);
        ExecutionResult result =
                spanHelper.inSpan(
                        "engine.run",
                        Map.of(
                                "forkgate.tier", tier.wireName(),
                                "forkgate.instruction_ceiling", budget.instructionCeiling(),
                                "forkgate.memory_ceiling", budget.memoryCeiling()),
                        () -> runEngine(request, budget));

        ledger.addInstructionsExecuted(result.instructionsExecuted());
        ledger.addEngineTimeNanos(result.elapsedNanos());
        metrics.engineRunTimer(tier.wireName()).record(result.elapsedNanos(), TimeUnit.NANOSECONDS);

        ExecutionReport report = reportWriter.write(result);
        ledger.addBytesReturned(report.byteLength());
        ledger.incrementRequestsServed();

        log.info("executed {} instructions in {} ms, returned {} bytes",
                result.instructionsExecuted(),
                String.format(Locale.ROOT, "%.2f", result.elapsedNanos() / 1_000_000.0),
                report.byteLength());
        return report;
    }

    /** The budget {@code tier} runs under. Not metered. */
    public TierLimits limits(Tier tier) {
        return new TierLimits(tier, tierPolicy.budgetFor(tier));
    }

    /** Counts this query, then renders every ledger counter as plain text. */
    public String status() {
        ledger.incrementStatusQueries();
        return ledger.snapshot().toPlainText();
    }

    private ExecutionResult runEngine(ExecutionRequest request, ResourceBudget budget) {
        ExecutionResult result =
                engine.run(
                        request.programText(),
                        request.input(),
                        budget.instructionCeiling(),
                        budget.memoryCeiling());
        SpanHelper.annotateCurrent("forkgate.instructions_executed", result.instructionsExecuted());
        result.failure().ifPresent(step -> log.debug("Run ended with error: {}", step.message()));
        return result;
    }
}
