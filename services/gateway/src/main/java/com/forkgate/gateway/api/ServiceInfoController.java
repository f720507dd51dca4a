package com.forkgate.gateway.api;

import com.forkgate.gateway.config.GatewayProperties;
import com.forkgate.security.ResourceBudget;
import com.forkgate.security.Tier;
import com.forkgate.security.TierPolicy;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service info endpoint: identity of this deployment and the budget table it enforces.
 *
 * <p>Actuator's {@code /actuator/info} carries build metadata; this adds runtime configuration.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final GatewayProperties properties;
    private final TierPolicy tierPolicy;

    public ServiceInfoController(GatewayProperties properties, TierPolicy tierPolicy) {
        this.properties = properties;
        this.tierPolicy = tierPolicy;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> tiers = new LinkedHashMap<>();
        for (Map.Entry<Tier, ResourceBudget> entry : tierPolicy.asMap().entrySet()) {
            ResourceBudget budget = entry.getValue();
            tiers.put(entry.getKey().wireName(), Map.of(
                    "execution_limit", budget.instructionCeiling(),
                    "memory_limit", budget.memoryCeiling()));
        }
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "status", "running",
                "timestamp", Instant.now().toString(),
                "tiers", tiers);
    }
}
