package com.forkgate.gateway.config;

import com.forkgate.security.ResourceBudget;
import com.forkgate.security.Tier;
import com.forkgate.security.TierPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Per-tier execution budgets bound from {@code forkgate.tiers.*}. A tier left out of the
 * configuration keeps the budget from {@link TierPolicy#defaults()}.
 *
 * <pre>
 * forkgate:
 *   tiers:
 *     developer:
 *       execution-limit: 1000000
 *       memory-limit: 262144
 *     unauthenticated:
 *       execution-limit: 500
 *       memory-limit: 32000
 * </pre>
 *
 * <p>{@link #toPolicy()} rejects a table where a more privileged tier gets less than a less
 * privileged one, which stops the application from starting.
 */
@ConfigurationProperties(prefix = "forkgate.tiers")
@Validated
public record TierBudgetProperties(
        @Valid Budget administrator,
        @Valid Budget developer,
        @Valid Budget basic,
        @Valid Budget unauthenticated) {

    /**
     * @param executionLimit instruction ceiling
     * @param memoryLimit memory ceiling in cells
     */
    public record Budget(@Positive long executionLimit, @Positive long memoryLimit) {

        static Budget of(ResourceBudget budget) {
            return new Budget(budget.instructionCeiling(), budget.memoryCeiling());
        }

        ResourceBudget toResourceBudget() {
            return new ResourceBudget(executionLimit, memoryLimit);
        }
    }

    public TierBudgetProperties {
        TierPolicy defaults = TierPolicy.defaults();
        if (administrator == null) {
            administrator = Budget.of(defaults.budgetFor(Tier.ADMINISTRATOR));
        }
        if (developer == null) {
            developer = Budget.of(defaults.budgetFor(Tier.DEVELOPER));
        }
        if (basic == null) {
            basic = Budget.of(defaults.budgetFor(Tier.BASIC));
        }
        if (unauthenticated == null) {
            unauthenticated = Budget.of(defaults.budgetFor(Tier.UNAUTHENTICATED));
        }
    }

    /**
     * @throws IllegalArgumentException if a budget is not positive or the table is not monotonic
     */
    public TierPolicy toPolicy() {
        return new TierPolicy(
                administrator.toResourceBudget(),
                developer.toResourceBudget(),
                basic.toResourceBudget(),
                unauthenticated.toResourceBudget());
    }
}
