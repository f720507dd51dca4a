package com.forkgate.gateway.infrastructure.web;

import com.forkgate.security.RejectionReason;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

/** HTTP rendering of {@link RejectionReason}s, shared by every endpoint that can reject. */
public final class RejectionStatus {

    /** Retry hint sent with retryable rejections. */
    public static final Duration RETRY_AFTER = Duration.ofSeconds(1);

    private RejectionStatus() {
        // utility class
    }

    public static HttpStatus of(RejectionReason reason) {
        return switch (reason.category()) {
            case CLIENT -> HttpStatus.BAD_REQUEST;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    /** Headers for a rejection response: {@code Retry-After} when the reason is retryable. */
    public static HttpHeaders headers(RejectionReason reason) {
        HttpHeaders headers = new HttpHeaders();
        if (reason.retryable()) {
            headers.set(HttpHeaders.RETRY_AFTER, Long.toString(RETRY_AFTER.toSeconds()));
        }
        return headers;
    }
}
