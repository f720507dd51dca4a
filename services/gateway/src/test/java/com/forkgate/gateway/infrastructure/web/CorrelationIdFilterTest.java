package com.forkgate.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.forkgate.observability.CorrelationContext;
import com.forkgate.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation ID when none provided")
    void generatesCorrelationIdWhenNoneProvided() throws Exception {
        var request = new MockHttpServletRequest();
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an oversized correlation ID")
    void replacesOversizedCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(
                "X-Correlation-ID", "x".repeat(CorrelationIdFilter.MAX_CORRELATION_ID_LENGTH + 1));
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID"))
                .hasSizeLessThanOrEqualTo(CorrelationIdFilter.MAX_CORRELATION_ID_LENGTH);
    }

    @Test
    @DisplayName("populates context and MDC while the chain runs")
    void setsCorrelationContextDuringFilterChain() throws Exception {
        var capturedId = new AtomicReference<String>();
        var capturedMdc = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> {
            capturedId.set(CorrelationContextHolder.get()
                    .map(CorrelationContext::correlationId)
                    .orElse(null));
            capturedMdc.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        };
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(capturedId.get()).isEqualTo("during-chain-123");
        assertThat(capturedMdc.get()).isEqualTo("during-chain-123");
    }

    @Test
    @DisplayName("clears context after the request, including an attached tier")
    void clearsCorrelationContextAfterRequest() throws Exception {
        FilterChain chain = (req, resp) -> CorrelationContextHolder.attachAccessTier("basic");

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), chain);

        assertThat(CorrelationContextHolder.get()).isEmpty();
        assertThat(MDC.get(CorrelationContext.MDC_ACCESS_TIER)).isNull();
    }
}
