package com.voucherpay.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Response enrichment settings, bound from {@code voucherpay.accessibility.*}.
 *
 * @param wcagLevel advertised WCAG 2.1 conformance level (default AA)
 * @param enabled   whether responses are enriched (default true)
 */
@ConfigurationProperties(prefix = "voucherpay.accessibility")
public record AccessibilityProperties(String wcagLevel, Boolean enabled) {

    public AccessibilityProperties {
        if (wcagLevel == null || wcagLevel.isBlank()) {
            wcagLevel = "AA";
        }
        if (enabled == null) {
            enabled = true;
        }
    }
}
