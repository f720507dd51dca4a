package com.forkgate.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of {@code POST /api/v1/keys}: the new credential, or why none was issued. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IssueCredentialResponse(
        String key, @JsonProperty("error_message") String errorMessage) {

    static IssueCredentialResponse issued(String key) {
        return new IssueCredentialResponse(key, null);
    }

    static IssueCredentialResponse error(String message) {
        return new IssueCredentialResponse(null, message);
    }
}
