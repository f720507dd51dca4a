package com.forkgate.gateway.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service-level settings bound from {@code forkgate.service.*}.
 *
 * <pre>
 * forkgate:
 *   service:
 *     name: forkgate-gateway
 *     environment: production
 *     description: Tiered execution gateway
 *     allowed-origins:
 *       - https://playground.example.org
 * </pre>
 *
 * @param name service name used for logging and metric tags. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable service description
 * @param allowedOrigins browser origins allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "forkgate.service")
@Validated
public record GatewayProperties(
        @NotBlank String name,
        String environment,
        String description,
        List<String> allowedOrigins) {

    /** Applies defaults for optional fields; runs before Bean Validation. */
    public GatewayProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        } else {
            allowedOrigins = List.copyOf(allowedOrigins);
        }
    }
}
