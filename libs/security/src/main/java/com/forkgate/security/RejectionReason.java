package com.forkgate.security;

/**
 * Why the admission layer refused a request.
 *
 * <p>Each reason belongs to a {@link Category}; infrastructure reasons are retryable, everything
 * else is a final answer for the given input.
 */
public enum RejectionReason {

    /** More than one credential was presented in a single request. */
    MALFORMED_CREDENTIAL_PRESENTATION(Category.CLIENT, "exactly one credential may be presented"),

    /** The presented credential is not in the credential store. */
    UNRECOGNIZED_CREDENTIAL(Category.AUTHENTICATION, "credential not recognized"),

    /** The credential store could not be reached or returned an unusable record. */
    STORE_UNAVAILABLE(Category.INFRASTRUCTURE, "credential store unavailable, retry later"),

    /** The caller's tier does not allow the privileged operation. */
    NOT_AUTHORIZED(Category.AUTHORIZATION, "caller is not allowed to issue credentials"),

    /** The tier requested for a new credential cannot be issued. */
    INVALID_REQUESTED_TIER(Category.CLIENT, "requested tier cannot be issued"),

    /** The new credential could not be persisted. */
    ISSUANCE_FAILED(Category.INFRASTRUCTURE, "credential could not be stored, retry later");

    /** Broad class of a rejection, used by callers to decide how to react. */
    public enum Category {
        CLIENT,
        AUTHENTICATION,
        AUTHORIZATION,
        INFRASTRUCTURE
    }

    private final Category category;
    private final String message;

    RejectionReason(Category category, String message) {
        this.category = category;
        this.message = message;
    }

    public Category category() {
        return category;
    }

    /** Human-readable explanation, safe to show to clients. */
    public String message() {
        return message;
    }

    /** Whether repeating the same request later may succeed. */
    public boolean retryable() {
        return category == Category.INFRASTRUCTURE;
    }
}
