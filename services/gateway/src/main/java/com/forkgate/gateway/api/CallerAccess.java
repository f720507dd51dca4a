package com.forkgate.gateway.api;

import com.forkgate.gateway.infrastructure.web.AccessRejectedException;
import com.forkgate.observability.CorrelationContextHolder;
import com.forkgate.security.AccessResolution;
import com.forkgate.security.AccessResolver;
import com.forkgate.security.CredentialHeaderExtractor;
import com.forkgate.security.Tier;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Resolves the tier of the caller behind an HTTP request.
 *
 * <p>Controllers call this explicitly as their first step. A granted tier is attached to the
 * correlation context so the rest of the request logs under it.
 */
@Component
public class CallerAccess {

    private final AccessResolver accessResolver;

    public CallerAccess(AccessResolver accessResolver) {
        this.accessResolver = accessResolver;
    }

    /** Resolves every {@code X-API-Key} value the request carries. */
    public AccessResolution resolve(HttpServletRequest request) {
        Enumeration<String> values = request.getHeaders(CredentialHeaderExtractor.HEADER_NAME);
        List<String> headerValues = values == null ? List.of() : Collections.list(values);
        AccessResolution resolution =
                accessResolver.resolve(CredentialHeaderExtractor.extract(headerValues));
        resolution
                .grantedTier()
                .ifPresent(tier -> CorrelationContextHolder.attachAccessTier(tier.wireName()));
        return resolution;
    }

    /**
     * Resolves the caller's tier.
     *
     * @throws AccessRejectedException if resolution rejects the request
     */
    public Tier requireTier(HttpServletRequest request) {
        AccessResolution resolution = resolve(request);
        return resolution
                .grantedTier()
                .orElseThrow(() -> new AccessRejectedException(resolution.rejection()));
    }
}
