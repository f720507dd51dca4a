package com.forkgate.security;

import java.util.Optional;

/**
 * Outcome of {@link CredentialIssuer#issue}: the freshly minted credential, or why none was issued.
 *
 * <p>The credential is only ever disclosed through this value.
 *
 * @param credential the new credential, null when rejected
 * @param rejection the rejection reason, null when issued
 */
public record IssuanceResult(String credential, RejectionReason rejection) {

    public IssuanceResult {
        if ((credential == null) == (rejection == null)) {
            throw new IllegalArgumentException("exactly one of credential or rejection must be set");
        }
    }

    public static IssuanceResult issued(String credential) {
        return new IssuanceResult(credential, null);
    }

    public static IssuanceResult rejected(RejectionReason reason) {
        return new IssuanceResult(null, reason);
    }

    public boolean isIssued() {
        return credential != null;
    }

    public Optional<String> issuedCredential() {
        return Optional.ofNullable(credential);
    }

    public Optional<RejectionReason> rejectionReason() {
        return Optional.ofNullable(rejection);
    }

    @Override
    public String toString() {
        return isIssued()
                ? "IssuanceResult[credential=" + CredentialMasker.mask(credential) + "]"
                : "IssuanceResult[rejection=" + rejection + "]";
    }
}
