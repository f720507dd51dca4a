/**
 * Persistence for the credential table.
 *
 * <p>Flyway owns the schema ({@code db/migration/credentials/V{n}__{desc}.sql}); {@link
 * com.forkgate.database.store.JdbcCredentialStore} implements the {@code CredentialStore} port on
 * top of a bounded HikariCP pool.
 *
 * @see com.forkgate.database.config.CredentialDatabaseConfig
 */
package com.forkgate.database;
