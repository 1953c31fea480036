package com.voucherpay.api.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Browser origins allowed to call the API, bound from {@code voucherpay.cors.*}.
 */
@ConfigurationProperties(prefix = "voucherpay.cors")
public record CorsProperties(List<String> allowedOrigins) {

    public CorsProperties {
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        }
        allowedOrigins = List.copyOf(allowedOrigins);
    }
}
