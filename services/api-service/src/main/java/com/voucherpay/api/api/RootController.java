package com.voucherpay.api.api;

import com.voucherpay.api.config.AccessibilityProperties;
import com.voucherpay.api.config.ServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RootController {

    static final String VERSION = "1.0.0";

    private final ServiceProperties service;
    private final AccessibilityProperties accessibility;
    private final Clock clock;

    public RootController(ServiceProperties service, AccessibilityProperties accessibility, Clock clock) {
        this.service = service;
        this.accessibility = accessibility;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to VoucherPay Enterprise - Inclusive Platform API");
        body.put("service", service.name());
        body.put("environment", service.environment());
        body.put("version", VERSION);
        body.put("status", "operational");
        body.put("accessibility", Map.of(
                "wcag_compliance", "2.1 " + accessibility.wcagLevel(),
                "screen_reader_optimized", true,
                "keyboard_navigation", true,
                "high_contrast_support", true));
        body.put("empowerment_features", Map.of(
                "social_security_assistance", true,
                "accessible_housing", true,
                "business_funding", true,
                "non_discrimination_reporting", true,
                "inclusive_job_matching", true));
        body.put("endpoints", Map.of(
                "api_v1", "/api/v1",
                "health", "/health",
                "actuator", "/actuator/health"));
        return body;
    }

    /** Liveness summary for humans; probes should use {@code /actuator/health}. */
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", clock.instant().toEpochMilli() / 1000.0);
        body.put("services", Map.of(
                "analytics", "active",
                "email", "configured"));
        body.put("accessibility", Map.of(
                "compliance_check", "passed",
                "screen_reader_test", "passed",
                "keyboard_navigation_test", "passed"));
        return body;
    }
}
