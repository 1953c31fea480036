package com.voucherpay.api.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Analytics emission settings, bound from {@code voucherpay.analytics.*}.
 *
 * @param enabled       whether analytics events are derived at all (default true)
 * @param emitTimeout   time queued events get to drain at shutdown (default 500 ms)
 * @param queueCapacity events buffered before new ones are dropped (default 1000)
 */
@ConfigurationProperties(prefix = "voucherpay.analytics")
public record AnalyticsProperties(Boolean enabled, Duration emitTimeout, int queueCapacity) {

    public AnalyticsProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (emitTimeout == null || emitTimeout.isNegative()) {
            emitTimeout = Duration.ofMillis(500);
        }
        if (queueCapacity <= 0) {
            queueCapacity = 1000;
        }
    }
}
