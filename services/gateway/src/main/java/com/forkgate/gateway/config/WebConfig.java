package com.forkgate.gateway.config;

import com.forkgate.gateway.infrastructure.web.CorrelationIdFilter;
import com.forkgate.security.CredentialHeaderExtractor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for browser clients such as a playground front end.
 *
 * <p>Origins come from {@code forkgate.service.allowed-origins}.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final GatewayProperties properties;

    public WebConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("Content-Type", CredentialHeaderExtractor.HEADER_NAME,
                        CorrelationIdFilter.CORRELATION_ID_HEADER)
                .exposedHeaders(CorrelationIdFilter.CORRELATION_ID_HEADER, "Retry-After")
                .maxAge(3600);
    }
}
