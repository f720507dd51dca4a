package com.forkgate.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 *
 * <p>Setting a context populates the MDC keys so that every log statement on this thread includes
 * them; clearing removes them again. Request threads are pooled, so whoever sets a context must
 * clear it in a {@code finally} block.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // Utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        setMdc(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        setMdc(CorrelationContext.MDC_ACCESS_TIER, context.accessTier());
    }

    /** Returns the current thread's correlation context, if set. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Records the resolved tier on the current context. Does nothing when no context is set, e.g.
     * when a component is driven directly from a test.
     */
    public static void attachAccessTier(String tier) {
        get().ifPresent(ctx -> set(ctx.withAccessTier(tier)));
    }

    /** Clears the correlation context and removes its MDC keys for the current thread. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_ACCESS_TIER);
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
