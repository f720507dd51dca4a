package com.forkgate.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forkgate.engine.ExecutionEngine;
import com.forkgate.engine.TapeEngine;
import com.forkgate.gateway.domain.AdmissionGateway;
import com.forkgate.gateway.domain.ExecutionReportWriter;
import com.forkgate.observability.SpanHelper;
import com.forkgate.observability.UsageLedger;
import com.forkgate.observability.UsageLedgerMetrics;
import com.forkgate.security.AccessResolver;
import com.forkgate.security.CredentialIssuer;
import com.forkgate.security.CredentialStore;
import com.forkgate.security.TierPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core gateway wiring. Everything here is a plain object from the shared libraries; Spring only
 * decides the lifetimes, so each piece stays testable without a context.
 */
@Configuration
public class GatewayConfig {

    /** Instrumentation scope name for spans created by the gateway. */
    public static final String TRACER_NAME = "forkgate-gateway";

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    /** The single process-wide ledger. */
    @Bean
    public UsageLedger usageLedger() {
        return new UsageLedger();
    }

    @Bean
    public UsageLedgerMetrics usageLedgerMetrics(
            MeterRegistry meterRegistry, UsageLedger usageLedger, GatewayProperties properties) {
        var metrics = new UsageLedgerMetrics(meterRegistry, properties.name());
        metrics.bind(usageLedger);
        return metrics;
    }

    @Bean
    public TierPolicy tierPolicy(TierBudgetProperties budgets) {
        TierPolicy policy = budgets.toPolicy();
        log.info("Tier budgets: {}", policy.asMap());
        return policy;
    }

    @Bean
    public AccessResolver accessResolver(CredentialStore credentialStore) {
        return new AccessResolver(credentialStore);
    }

    @Bean
    public CredentialIssuer credentialIssuer(CredentialStore credentialStore) {
        return new CredentialIssuer(credentialStore);
    }

    /** Bundled engine; a deployment may supply its own {@link ExecutionEngine} bean instead. */
    @Bean
    @ConditionalOnMissingBean(ExecutionEngine.class)
    public ExecutionEngine executionEngine(EngineProperties engine) {
        log.info("Engine trace limit: {}", engine.traceLimit());
        return new TapeEngine(engine.traceLimit().toBytes());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(TRACER_NAME));
    }

    @Bean
    public ExecutionReportWriter executionReportWriter(ObjectMapper objectMapper) {
        return new ExecutionReportWriter(objectMapper);
    }

    @Bean
    public AdmissionGateway admissionGateway(
            TierPolicy tierPolicy,
            ExecutionEngine executionEngine,
            UsageLedger usageLedger,
            UsageLedgerMetrics usageLedgerMetrics,
            ExecutionReportWriter executionReportWriter,
            SpanHelper spanHelper) {
        return new AdmissionGateway(
                tierPolicy,
                executionEngine,
                usageLedger,
                usageLedgerMetrics,
                executionReportWriter,
                spanHelper);
    }
}
