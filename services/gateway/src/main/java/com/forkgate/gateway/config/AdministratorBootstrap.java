package com.forkgate.gateway.config;

import com.forkgate.security.CredentialMasker;
import com.forkgate.security.CredentialRecord;
import com.forkgate.security.CredentialStore;
import com.forkgate.security.CredentialStoreException;
import com.forkgate.security.Tier;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Provisions the configured administrator credential when the gateway starts.
 *
 * <p>The issuance endpoint only mints developer and basic credentials, so this is the one path by
 * which an administrator record enters the store. An existing record is left untouched; an existing
 * record bound to another tier is reported but not rewritten, since records are immutable.
 */
@Component
public class AdministratorBootstrap implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(AdministratorBootstrap.class);

    private final BootstrapProperties properties;
    private final CredentialStore store;
    private final Clock clock;

    @Autowired
    public AdministratorBootstrap(BootstrapProperties properties, CredentialStore store) {
        this(properties, store, Clock.systemUTC());
    }

    AdministratorBootstrap(BootstrapProperties properties, CredentialStore store, Clock clock) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        provision();
    }

    /**
     * Inserts the administrator credential if it is configured and absent.
     *
     * @return true if a record was inserted
     * @throws IllegalStateException if the store cannot be read or written
     */
    public boolean provision() {
        if (!properties.hasAdminCredential()) {
            log.debug("No administrator credential configured");
            return false;
        }
        String credential = properties.adminCredential();
        String masked = CredentialMasker.mask(credential);
        try {
            Optional<Tier> existing = store.lookup(credential);
            if (existing.isPresent()) {
                if (existing.get() != Tier.ADMINISTRATOR) {
                    log.warn("Bootstrap credential {} is already stored as {}, not administrator",
                            masked, existing.get().wireName());
                } else {
                    log.info("Administrator credential {} already provisioned", masked);
                }
                return false;
            }
            store.insert(new CredentialRecord(
                    credential, Tier.ADMINISTRATOR, properties.adminLabel(), Instant.now(clock)));
        } catch (CredentialStoreException e) {
            throw new IllegalStateException(
                    "Could not provision administrator credential " + masked, e);
        }
        log.info("Provisioned administrator credential {}", masked);
        return true;
    }
}
