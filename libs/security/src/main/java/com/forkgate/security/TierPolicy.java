package com.forkgate.security;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link Tier} to its statically configured {@link ResourceBudget}.
 *
 * <p>The mapping is total: every tier has a budget, and {@link Tier#UNAUTHENTICATED} uses the
 * default budget. Budgets must not shrink as privilege grows; a table that violates this is rejected
 * at construction.
 */
public final class TierPolicy {

    private final ResourceBudget administrator;
    private final ResourceBudget developer;
    private final ResourceBudget basic;
    private final ResourceBudget defaultBudget;

    /**
     * @throws IllegalArgumentException if a budget is missing or a more privileged tier gets a
     *     smaller budget than a less privileged one
     */
    public TierPolicy(
            ResourceBudget administrator,
            ResourceBudget developer,
            ResourceBudget basic,
            ResourceBudget defaultBudget) {
        if (administrator == null || developer == null || basic == null || defaultBudget == null) {
            throw new IllegalArgumentException("every tier must have a budget");
        }
        this.administrator = administrator;
        this.developer = developer;
        this.basic = basic;
        this.defaultBudget = defaultBudget;
        verifyOrdering();
    }

    /** The budgets the service ships with. */
    public static TierPolicy defaults() {
        return new TierPolicy(
                new ResourceBudget(10_000_000, 1_048_576),
                new ResourceBudget(1_000_000, 262_144),
                new ResourceBudget(50_000, 65_536),
                new ResourceBudget(500, 32_000));
    }

    /** Returns the budget for {@code tier}. */
    public ResourceBudget budgetFor(Tier tier) {
        return switch (tier) {
            case ADMINISTRATOR -> administrator;
            case DEVELOPER -> developer;
            case BASIC -> basic;
            case UNAUTHENTICATED -> defaultBudget;
        };
    }

    /** Budgets keyed by tier, in privilege order. */
    public Map<Tier, ResourceBudget> asMap() {
        Map<Tier, ResourceBudget> budgets = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            budgets.put(tier, budgetFor(tier));
        }
        return budgets;
    }

    private void verifyOrdering() {
        List<Tier> tiers = List.of(Tier.values());
        for (int i = 1; i < tiers.size(); i++) {
            Tier higher = tiers.get(i - 1);
            Tier lower = tiers.get(i);
            if (!budgetFor(higher).covers(budgetFor(lower))) {
                throw new IllegalArgumentException(
                        "budget for %s must cover budget for %s"
                                .formatted(higher.wireName(), lower.wireName()));
            }
        }
    }
}
