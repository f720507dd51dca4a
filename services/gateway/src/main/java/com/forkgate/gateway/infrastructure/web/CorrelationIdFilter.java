package com.forkgate.gateway.infrastructure.web;

import com.forkgate.observability.CorrelationContext;
import com.forkgate.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>An incoming {@code X-Correlation-ID} is reused; otherwise a random UUID is assigned. The ID is
 * placed in {@link CorrelationContextHolder} (and so in the MDC) for the duration of the request and
 * echoed in the response header. Controllers add the resolved tier once access has been decided.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so every later filter and handler sees the context.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Longest client-supplied ID accepted; longer ones are replaced. */
    static final int MAX_CORRELATION_ID_LENGTH = 128;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null
                || correlationId.isBlank()
                || correlationId.length() > MAX_CORRELATION_ID_LENGTH) {
            correlationId = UUID.randomUUID().toString();
        }

        CorrelationContextHolder.set(new CorrelationContext(correlationId, null));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
