package com.forkgate.gateway.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.forkgate.security.CredentialIssuer;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/keys}.
 *
 * @param accessLevel wire name of the tier to issue, {@code developer} or {@code basic}
 * @param label note stored with the credential
 */
public record IssueCredentialRequest(
        @JsonProperty("access_level") @NotNull String accessLevel,
        @NotBlank @Size(max = CredentialIssuer.MAX_LABEL_LENGTH) String label) {}
