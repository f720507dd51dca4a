package com.forkgate.observability;

/**
 * Identifiers attached to one inbound request and copied into every log line it produces.
 *
 * @param correlationId unique ID for the request, propagated from or returned to the client
 * @param accessTier wire name of the resolved tier, null until access has been resolved
 */
public record CorrelationContext(String correlationId, String accessTier) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the resolved access tier. */
    public static final String MDC_ACCESS_TIER = "accessTier";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Copy of this context with the resolved tier filled in. */
    public CorrelationContext withAccessTier(String tier) {
        return new CorrelationContext(correlationId, tier);
    }
}
