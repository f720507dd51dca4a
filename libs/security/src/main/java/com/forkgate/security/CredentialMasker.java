package com.forkgate.security;

/**
 * Shortens credentials for log output so that a log line never contains a usable credential.
 *
 * <p>Only the first {@value #VISIBLE_PREFIX} characters survive; short values are fully masked.
 */
public final class CredentialMasker {

    /** Replacement used for the hidden part of a credential. */
    public static final String MASK = "****";

    static final int VISIBLE_PREFIX = 4;

    private CredentialMasker() {
        // utility class
    }

    /**
     * Masks a credential for logging.
     *
     * @param credential the raw credential, may be null
     * @return e.g. {@code "3f9a****"}; {@value #MASK} for short or null input
     */
    public static String mask(String credential) {
        if (credential == null || credential.length() <= VISIBLE_PREFIX * 2) {
            return MASK;
        }
        return credential.substring(0, VISIBLE_PREFIX) + MASK;
    }
}
