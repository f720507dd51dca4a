package com.forkgate.security;

/**
 * Raised by a {@link CredentialStore} when it cannot answer: connection failures, pool exhaustion,
 * constraint violations on insert, or a stored record that does not decode.
 */
public class CredentialStoreException extends RuntimeException {

    private final boolean dataIntegrityFault;

    public CredentialStoreException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private CredentialStoreException(String message, Throwable cause, boolean dataIntegrityFault) {
        super(message, cause);
        this.dataIntegrityFault = dataIntegrityFault;
    }

    /** A stored record exists but its tier code maps to no known tier. */
    public static CredentialStoreException unknownTierCode(int code) {
        return new CredentialStoreException(
                "Stored credential has unknown tier code " + code, null, true);
    }

    /** Whether the store answered but its data is corrupt, as opposed to being unreachable. */
    public boolean isDataIntegrityFault() {
        return dataIntegrityFault;
    }
}
