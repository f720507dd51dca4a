package com.forkgate.security;

import java.time.Instant;

/**
 * A persisted credential. Written once by issuance and never modified afterwards.
 *
 * @param credential the opaque bearer string
 * @param tier the tier the credential grants; never {@link Tier#UNAUTHENTICATED}
 * @param label human-readable note about who or what the credential is for
 * @param createdAt when the record was created
 */
public record CredentialRecord(String credential, Tier tier, String label, Instant createdAt) {

    public CredentialRecord {
        if (credential == null || credential.isBlank()) {
            throw new IllegalArgumentException("credential must not be null or blank");
        }
        if (tier == null || tier.storageCode().isEmpty()) {
            throw new IllegalArgumentException("tier must be a storable tier: " + tier);
        }
        if (label == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt must not be null");
        }
    }

    /** Credential value is masked so records can be logged safely. */
    @Override
    public String toString() {
        return "CredentialRecord[credential=%s, tier=%s, label=%s, createdAt=%s]"
                .formatted(CredentialMasker.mask(credential), tier, label, createdAt);
    }
}
