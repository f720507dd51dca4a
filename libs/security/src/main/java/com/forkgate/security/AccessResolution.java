package com.forkgate.security;

import java.util.Optional;

/**
 * Outcome of {@link AccessResolver#resolve}: either a granted tier or a rejection reason.
 *
 * <p>Exactly one of the two components is non-null.
 *
 * @param tier the resolved tier, null when rejected
 * @param rejection the rejection reason, null when granted
 */
public record AccessResolution(Tier tier, RejectionReason rejection) {

    public AccessResolution {
        if ((tier == null) == (rejection == null)) {
            throw new IllegalArgumentException("exactly one of tier or rejection must be set");
        }
    }

    public static AccessResolution granted(Tier tier) {
        return new AccessResolution(tier, null);
    }

    public static AccessResolution rejected(RejectionReason reason) {
        return new AccessResolution(null, reason);
    }

    public boolean isGranted() {
        return tier != null;
    }

    public Optional<Tier> grantedTier() {
        return Optional.ofNullable(tier);
    }

    public Optional<RejectionReason> rejectionReason() {
        return Optional.ofNullable(rejection);
    }
}
