package com.forkgate.gateway.config;

import jakarta.validation.constraints.Size;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Start-up provisioning bound from {@code forkgate.bootstrap.*}.
 *
 * <p>Administrator credentials cannot be issued over HTTP. Setting {@code admin-credential} (usually
 * from an environment variable) makes the gateway ensure that credential exists as an administrator
 * record when it starts.
 *
 * @param adminCredential administrator credential to provision, null to skip
 * @param adminLabel label stored with the provisioned credential
 */
@ConfigurationProperties(prefix = "forkgate.bootstrap")
@Validated
public record BootstrapProperties(
        @Size(min = 16, max = 64) String adminCredential,
        @Size(max = 255) String adminLabel) {

    public BootstrapProperties {
        if (adminCredential != null && adminCredential.isBlank()) {
            adminCredential = null;
        }
        if (adminLabel == null || adminLabel.isBlank()) {
            adminLabel = "bootstrap administrator";
        }
    }

    public boolean hasAdminCredential() {
        return adminCredential != null;
    }
}
