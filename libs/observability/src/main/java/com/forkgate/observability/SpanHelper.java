package com.forkgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that tags every span with the current
 * {@link CorrelationContext}.
 *
 * <p>Does not configure the SDK. Without one installed the global tracer is a no-op and spans cost
 * next to nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer (typically obtained from {@code GlobalOpenTelemetry})
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} inside a new internal span.
     *
     * @param spanName name for the span
     * @param attributes span attributes, long values are recorded as numbers
     * @param work the work to run
     * @return whatever {@code work} returns
     */
    public <T> T inSpan(String spanName, Map<String, Object> attributes, Supplier<T> work) {
        Span span = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL).startSpan();
        attributes.forEach((key, value) -> setAttribute(span, key, value));
        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.accessTier() != null) {
                span.setAttribute("access.tier", ctx.accessTier());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Attribute on the span currently in scope; no-op outside a span. */
    public static void annotateCurrent(String key, long value) {
        Span.current().setAttribute(key, value);
    }

    private static void setAttribute(Span span, String key, Object value) {
        if (value instanceof Long l) {
            span.setAttribute(key, l);
        } else if (value instanceof Integer i) {
            span.setAttribute(key, i.longValue());
        } else if (value != null) {
            span.setAttribute(key, value.toString());
        }
    }
}
