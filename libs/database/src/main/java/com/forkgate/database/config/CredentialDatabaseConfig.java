package com.forkgate.database.config;

import com.forkgate.database.store.JdbcCredentialStore;
import com.zaxxer.hikari.HikariDataSource;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Wires the credential database: a bounded HikariCP pool, the Flyway instance that owns its
 * schema, and the {@link JdbcCredentialStore} on top.
 *
 * <p>Spring Boot's own Flyway auto-configuration must be switched off in services importing this
 * configuration:
 *
 * <pre>{@code
 * spring:
 *   flyway:
 *     enabled: false
 * }</pre>
 *
 * @see CredentialStoreProperties
 */
@Configuration
@EnableConfigurationProperties(CredentialStoreProperties.class)
public class CredentialDatabaseConfig {

    /** Bean name for the credential database Flyway instance. */
    public static final String CREDENTIALS_FLYWAY_BEAN = "credentialsFlyway";

    /** Name of the HikariCP pool, visible in pool metrics and thread names. */
    public static final String POOL_NAME = "forkgate-credentials";

    private static final Logger log = LoggerFactory.getLogger(CredentialDatabaseConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource credentialDataSource(CredentialStoreProperties properties) {
        return createDataSource(properties);
    }

    /**
     * Flyway instance for the credential schema. Pending migrations are applied here when {@code
     * migrate-on-startup} is set, before any store bean can use the pool.
     */
    @Bean(name = CREDENTIALS_FLYWAY_BEAN)
    public Flyway credentialsFlyway(
            HikariDataSource credentialDataSource, CredentialStoreProperties properties) {
        Flyway flyway = createFlyway(credentialDataSource, properties);
        if (properties.migrateOnStartup()) {
            var result = flyway.migrate();
            log.info("Credential schema at version {} ({} migrations applied)",
                    result.targetSchemaVersion, result.migrationsExecuted);
        }
        return flyway;
    }

    @Bean
    public JdbcCredentialStore credentialStore(
            HikariDataSource credentialDataSource, Flyway credentialsFlyway) {
        return new JdbcCredentialStore(new JdbcTemplate(credentialDataSource));
    }

    // ── Helpers, public for tests that build the stack without Spring ──

    /** Builds the bounded pool described by {@code properties}. */
    public static HikariDataSource createDataSource(CredentialStoreProperties properties) {
        HikariDataSource dataSource =
                DataSourceBuilder.create()
                        .type(HikariDataSource.class)
                        .url(properties.url())
                        .username(properties.username())
                        .password(properties.password())
                        .build();
        dataSource.setPoolName(POOL_NAME);
        dataSource.setMaximumPoolSize(properties.maximumPoolSize());
        dataSource.setConnectionTimeout(properties.connectionTimeout().toMillis());
        return dataSource;
    }

    /** Configures Flyway for the credential schema without running it. */
    public static Flyway createFlyway(DataSource dataSource, CredentialStoreProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations())
                .baselineOnMigrate(true)
                .cleanDisabled(true)
                .load();
    }
}
