package com.forkgate.security;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the credentials presented with a request to a {@link Tier}.
 *
 * <p>Rules:
 *
 * <ul>
 *   <li>no credential: {@link Tier#UNAUTHENTICATED}, the store is not consulted
 *   <li>more than one credential: {@link RejectionReason#MALFORMED_CREDENTIAL_PRESENTATION}
 *   <li>one credential: the tier stored for it, {@link RejectionReason#UNRECOGNIZED_CREDENTIAL}
 *       when unknown, {@link RejectionReason#STORE_UNAVAILABLE} when the store cannot answer
 * </ul>
 *
 * <p>Resolution only reads the store. Usage is recorded by the gateway once a run completes.
 */
public final class AccessResolver {

    private static final Logger log = LoggerFactory.getLogger(AccessResolver.class);

    private final CredentialStore store;

    public AccessResolver(CredentialStore store) {
        if (store == null) {
            throw new IllegalArgumentException("store must not be null");
        }
        this.store = store;
    }

    /**
     * Resolves the presented credentials.
     *
     * @param presented every credential value the request carried, in arrival order; null is
     *     treated as none
     * @return the granted tier or the reason for rejection
     */
    public AccessResolution resolve(List<String> presented) {
        if (presented == null || presented.isEmpty()) {
            return AccessResolution.granted(Tier.UNAUTHENTICATED);
        }
        if (presented.size() > 1) {
            log.debug("Rejecting request presenting {} credentials", presented.size());
            return AccessResolution.rejected(RejectionReason.MALFORMED_CREDENTIAL_PRESENTATION);
        }

        String credential = presented.get(0);
        Optional<Tier> stored;
        try {
            stored = store.lookup(credential);
        } catch (CredentialStoreException e) {
            if (e.isDataIntegrityFault()) {
                log.error(
                        "Credential {} has a corrupt record: {}",
                        CredentialMasker.mask(credential),
                        e.getMessage());
            } else {
                log.warn(
                        "Credential store unavailable while resolving {}: {}",
                        CredentialMasker.mask(credential),
                        e.getMessage());
            }
            return AccessResolution.rejected(RejectionReason.STORE_UNAVAILABLE);
        }

        if (stored.isEmpty()) {
            log.info("Unrecognized credential {}", CredentialMasker.mask(credential));
            return AccessResolution.rejected(RejectionReason.UNRECOGNIZED_CREDENTIAL);
        }
        return AccessResolution.granted(stored.get());
    }
}
