package com.forkgate.security;

import java.util.Optional;

/**
 * Durable mapping from credential string to tier.
 *
 * <p>Implementations acquire a connection for the duration of one call and release it on every exit
 * path. A call that cannot obtain a connection within a bounded wait fails with {@link
 * CredentialStoreException}; it never blocks indefinitely.
 */
public interface CredentialStore {

    /**
     * Looks up the tier bound to a credential.
     *
     * @param credential the presented credential
     * @return the stored tier, or empty when the credential is unknown
     * @throws CredentialStoreException if the store cannot be reached, or the stored record carries
     *     a tier code that maps to no known tier
     */
    Optional<Tier> lookup(String credential);

    /**
     * Persists a new credential record.
     *
     * @param record the record to write
     * @throws CredentialStoreException if the write fails, including when the credential already
     *     exists
     */
    void insert(CredentialRecord record);
}
