package com.forkgate.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.forkgate.gateway.config.TierBudgetProperties.Budget;
import com.forkgate.security.ResourceBudget;
import com.forkgate.security.Tier;
import com.forkgate.security.TierPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TierBudgetProperties")
class TierBudgetPropertiesTest {

    @Test
    @DisplayName("unset tiers fall back to the default budgets")
    void defaultsApplied() {
        var props = new TierBudgetProperties(null, null, null, null);

        TierPolicy policy = props.toPolicy();

        assertThat(policy.asMap()).isEqualTo(TierPolicy.defaults().asMap());
        assertThat(policy.budgetFor(Tier.UNAUTHENTICATED))
                .isEqualTo(new ResourceBudget(500, 32_000));
    }

    @Test
    @DisplayName("configured budgets override the defaults")
    void overridesApplied() {
        var props = new TierBudgetProperties(null, new Budget(2_000_000, 500_000), null, null);

        assertThat(props.toPolicy().budgetFor(Tier.DEVELOPER))
                .isEqualTo(new ResourceBudget(2_000_000, 500_000));
    }

    @Test
    @DisplayName("rejects a table where a lower tier outgrows a higher one")
    void rejectsNonMonotonicTable() {
        var props = new TierBudgetProperties(null, null, new Budget(5_000_000, 65_536), null);

        assertThatThrownBy(props::toPolicy)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("budget for developer must cover budget for basic");
    }
}
