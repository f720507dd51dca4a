package com.forkgate.gateway.infrastructure.web;

import com.forkgate.security.RejectionReason;

/**
 * Raised by controllers when access resolution rejects a request. Rendered by {@link
 * GlobalExceptionHandler}.
 */
public class AccessRejectedException extends RuntimeException {

    private final RejectionReason reason;

    public AccessRejectedException(RejectionReason reason) {
        super(reason.message());
        this.reason = reason;
    }

    public RejectionReason reason() {
        return reason;
    }
}
