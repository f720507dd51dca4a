package com.forkgate.gateway.config;

import com.forkgate.engine.TapeEngine;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Bundled engine settings bound from {@code forkgate.engine.*}.
 *
 * <pre>
 * forkgate:
 *   engine:
 *     trace-limit: 4MB
 * </pre>
 *
 * @param traceLimit memory and output bytes one run's step trace may hold before it is truncated
 */
@ConfigurationProperties(prefix = "forkgate.engine")
public record EngineProperties(DataSize traceLimit) {

    public EngineProperties {
        if (traceLimit == null) {
            traceLimit = DataSize.ofBytes(TapeEngine.DEFAULT_TRACE_BYTE_LIMIT);
        }
        if (traceLimit.toBytes() < 1) {
            throw new IllegalArgumentException("forkgate.engine.trace-limit must be positive");
        }
    }
}
