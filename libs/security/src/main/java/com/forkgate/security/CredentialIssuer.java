package com.forkgate.security;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints new credentials on behalf of an administrator.
 *
 * <p>Only an {@link Tier#ADMINISTRATOR} caller may issue, and only tiers for which {@link
 * Tier#isIssuable()} holds may be requested. A successful issue persists the record and returns the
 * credential exactly once; there is no other way to read it back.
 */
public final class CredentialIssuer {

    /** Longest label the credential table accepts. */
    public static final int MAX_LABEL_LENGTH = 255;

    private static final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);

    private final CredentialStore store;
    private final CredentialGenerator generator;
    private final Clock clock;

    public CredentialIssuer(CredentialStore store) {
        this(store, CredentialGenerator.secureRandom(), Clock.systemUTC());
    }

    public CredentialIssuer(CredentialStore store, CredentialGenerator generator, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        if (generator == null) {
            throw new IllegalArgumentException("generator must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.store = store;
        this.generator = generator;
        this.clock = clock;
    }

    /**
     * Issues a credential bound to {@code requestedTier}.
     *
     * @param requestedTier tier the new credential grants
     * @param label human-readable note stored with the credential
     * @param callerTier tier of the caller asking for the credential
     * @return the credential, or {@link RejectionReason#NOT_AUTHORIZED}, {@link
     *     RejectionReason#INVALID_REQUESTED_TIER} or {@link RejectionReason#ISSUANCE_FAILED}
     * @throws IllegalArgumentException if the label is blank or longer than {@link
     *     #MAX_LABEL_LENGTH}
     */
    public IssuanceResult issue(Tier requestedTier, String label, Tier callerTier) {
        if (callerTier != Tier.ADMINISTRATOR) {
            log.warn("Issuance refused for caller tier {}", callerTier);
            return IssuanceResult.rejected(RejectionReason.NOT_AUTHORIZED);
        }
        if (requestedTier == null || !requestedTier.isIssuable()) {
            log.info("Issuance refused for requested tier {}", requestedTier);
            return IssuanceResult.rejected(RejectionReason.INVALID_REQUESTED_TIER);
        }
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be null or blank");
        }
        if (label.length() > MAX_LABEL_LENGTH) {
            throw new IllegalArgumentException(
                    "label must be at most " + MAX_LABEL_LENGTH + " characters");
        }

        String credential = generator.generate();
        var record = new CredentialRecord(credential, requestedTier, label, Instant.now(clock));
        try {
            store.insert(record);
        } catch (CredentialStoreException e) {
            log.warn("Failed to store new {} credential '{}': {}",
                    requestedTier.wireName(), label, e.getMessage());
            return IssuanceResult.rejected(RejectionReason.ISSUANCE_FAILED);
        }

        log.info("Issued {} credential {} for '{}'",
                requestedTier.wireName(), CredentialMasker.mask(credential), label);
        return IssuanceResult.issued(credential);
    }
}
