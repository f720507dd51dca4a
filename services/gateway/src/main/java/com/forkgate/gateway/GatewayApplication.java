package com.forkgate.gateway;

import com.forkgate.database.config.CredentialDatabaseConfig;
import com.forkgate.gateway.config.BootstrapProperties;
import com.forkgate.gateway.config.EngineProperties;
import com.forkgate.gateway.config.GatewayProperties;
import com.forkgate.gateway.config.TierBudgetProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

/**
 * Forkgate gateway: admits execution requests by credential tier, runs them under the tier's
 * budget and meters usage.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics, Prometheus endpoints, including the usage ledger counters
 *   <li>Correlation ID propagation (HTTP filter, MDC)
 *   <li>Structured error handling (RFC 7807 ProblemDetail)
 *   <li>Credential database migrations on start-up
 * </ul>
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@Import(CredentialDatabaseConfig.class)
@EnableConfigurationProperties({
    GatewayProperties.class,
    TierBudgetProperties.class,
    BootstrapProperties.class,
    EngineProperties.class
})
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
        log.info("Forkgate gateway started");
    }
}
