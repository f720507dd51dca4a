package com.forkgate.database.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CredentialStoreProperties")
class CredentialStorePropertiesTest {

    @Test
    @DisplayName("applies defaults for optional fields")
    void appliesDefaults() {
        var props = new CredentialStoreProperties("jdbc:h2:mem:x", "sa", null, 0, null, null, null);

        assertThat(props.password()).isEmpty();
        assertThat(props.maximumPoolSize()).isEqualTo(10);
        assertThat(props.connectionTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(props.locations()).isEqualTo(CredentialStoreProperties.DEFAULT_LOCATIONS);
        assertThat(props.migrateOnStartup()).isTrue();
    }

    @Test
    @DisplayName("raises connection timeouts below the HikariCP minimum")
    void raisesTinyTimeout() {
        var props = new CredentialStoreProperties(
                "jdbc:h2:mem:x", "sa", "", 2, Duration.ofMillis(10), null, false);

        assertThat(props.connectionTimeout())
                .isEqualTo(CredentialStoreProperties.MIN_CONNECTION_TIMEOUT);
        assertThat(props.migrateOnStartup()).isFalse();
    }

    @Test
    @DisplayName("keeps explicit values")
    void keepsExplicitValues() {
        var props = new CredentialStoreProperties(
                "jdbc:postgresql://db/forkgate", "forkgate", "pw", 4, Duration.ofSeconds(1),
                "classpath:custom", true);

        assertThat(props.maximumPoolSize()).isEqualTo(4);
        assertThat(props.connectionTimeout()).isEqualTo(Duration.ofSeconds(1));
        assertThat(props.locations()).isEqualTo("classpath:custom");
    }
}
