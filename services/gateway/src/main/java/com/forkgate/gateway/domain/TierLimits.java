package com.forkgate.gateway.domain;

import com.forkgate.security.ResourceBudget;
import com.forkgate.security.Tier;

/**
 * The budget a caller would run under.
 *
 * @param tier the caller's resolved tier
 * @param budget the budget configured for that tier
 */
public record TierLimits(Tier tier, ResourceBudget budget) {

    public TierLimits {
        if (tier == null || budget == null) {
            throw new IllegalArgumentException("tier and budget must not be null");
        }
    }
}
