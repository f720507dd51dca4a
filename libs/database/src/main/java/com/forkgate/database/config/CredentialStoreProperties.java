package com.forkgate.database.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the credential database, bound from {@code forkgate.store.*}.
 *
 * <pre>{@code
 * forkgate:
 *   store:
 *     url: jdbc:postgresql://localhost:5432/forkgate
 *     username: forkgate
 *     password: forkgate_dev_password
 *     maximum-pool-size: 10
 *     connection-timeout: 2s
 *     locations: classpath:db/migration/credentials
 *     migrate-on-startup: true
 * }</pre>
 *
 * @param url JDBC connection URL
 * @param username database user
 * @param password database password, may be empty
 * @param maximumPoolSize upper bound on open connections (default 10)
 * @param connectionTimeout longest wait for a free connection before the store reports itself
 *     unavailable (default 2s, at least 250ms)
 * @param locations Flyway migration locations
 * @param migrateOnStartup whether to apply pending migrations when the application starts
 */
@Validated
@ConfigurationProperties(prefix = "forkgate.store")
public record CredentialStoreProperties(
        @NotBlank String url,
        @NotBlank String username,
        String password,
        int maximumPoolSize,
        Duration connectionTimeout,
        String locations,
        Boolean migrateOnStartup) {

    /** Smallest connection timeout HikariCP accepts. */
    public static final Duration MIN_CONNECTION_TIMEOUT = Duration.ofMillis(250);

    public static final String DEFAULT_LOCATIONS = "classpath:db/migration/credentials";

    /** Applies defaults for optional fields before Bean Validation runs. */
    public CredentialStoreProperties {
        if (password == null) {
            password = "";
        }
        if (maximumPoolSize <= 0) {
            maximumPoolSize = 10;
        }
        if (connectionTimeout == null) {
            connectionTimeout = Duration.ofSeconds(2);
        } else if (connectionTimeout.compareTo(MIN_CONNECTION_TIMEOUT) < 0) {
            connectionTimeout = MIN_CONNECTION_TIMEOUT;
        }
        if (locations == null || locations.isBlank()) {
            locations = DEFAULT_LOCATIONS;
        }
        if (migrateOnStartup == null) {
            migrateOnStartup = Boolean.TRUE;
        }
    }
}
