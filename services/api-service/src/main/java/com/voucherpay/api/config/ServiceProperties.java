package com.voucherpay.api.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code voucherpay.service.*}.
 *
 * @param name        service name used for logging and the metrics {@code service} tag. Required.
 * @param environment deployment environment (development, staging, production)
 * @param description human-readable description
 */
@ConfigurationProperties(prefix = "voucherpay.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (description == null) {
            description = "";
        }
    }
}
