package com.voucherpay.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voucherpay.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds accessibility headers to every response and, for JSON object bodies, an
 * {@code _accessibility} block plus screen-reader and user-friendly variants of
 * {@code error.message}.
 * <p>
 * The status is never changed. Bodies that are not JSON objects are passed through
 * byte-for-byte; a body that claims to be JSON but does not parse is logged and passed
 * through as well.
 */
public class ResponseEnrichmentStage implements ResponseStage {

    private static final Logger log = LoggerFactory.getLogger(ResponseEnrichmentStage.class);

    public static final String ACCESSIBILITY_KEY = "_accessibility";

    /** Status-code fragments of an error message, checked in order. */
    static final Map<String, String> SCREEN_READER_MESSAGES = orderedMap(
            "401", "Authentication required. Please log in to continue.",
            "403", "Access denied. You don't have permission for this action.",
            "404", "The requested resource was not found.",
            "422", "The submitted data contains errors. Please check and try again.",
            "500", "A server error occurred. Please try again later or contact support.");

    /** Lower-case trigger phrases, checked in order. */
    static final Map<String, String> USER_FRIENDLY_MESSAGES = orderedMap(
            "validation error", "Please check the information you entered and try again.",
            "unauthorized", "Please sign in to access this feature.",
            "forbidden", "You don't have permission to perform this action.",
            "not found", "The item you're looking for couldn't be found.",
            "internal server error", "Something went wrong. Please try again in a moment.");

    private final ObjectMapper mapper;
    private final String wcagLevel;
    private final Counter failures;

    public ResponseEnrichmentStage(ObjectMapper mapper, String wcagLevel, MetricFactory metrics) {
        this.mapper = mapper;
        this.wcagLevel = wcagLevel == null || wcagLevel.isBlank() ? "AA" : wcagLevel;
        this.failures = metrics.counter("pipeline.enrichment.failures", "Response bodies that could not be enriched");
    }

    @Override
    public PipelineResponse afterHandler(PipelineExchange exchange, PipelineResponse response) {
        PipelineResponse withHeaders = response
                .withHeader("X-Accessibility-Compliant", "WCAG-2.1-" + wcagLevel)
                .withHeader("X-Screen-Reader-Optimized", "true")
                .withHeader("X-Keyboard-Accessible", "true")
                .withHeader("X-High-Contrast-Support", "true")
                .withHeader("X-Content-Language", AccessibilityContext.DEFAULT_LANGUAGE);
        if (!response.isJson() || response.body().length == 0) {
            return withHeaders;
        }
        try {
            return enrichBody(withHeaders, exchange.accessibilityContext());
        } catch (JsonProcessingException e) {
            failures.increment();
            log.warn("Failed to enhance response with accessibility features: {}", e.getOriginalMessage());
            return withHeaders;
        }
    }

    private PipelineResponse enrichBody(PipelineResponse response, AccessibilityContext context)
            throws JsonProcessingException {
        JsonNode root = mapper.readTree(response.bodyAsString());
        if (!(root instanceof ObjectNode body)) {
            return response;
        }
        ObjectNode accessibility = body.putObject(ACCESSIBILITY_KEY);
        accessibility.put("wcag_level", wcagLevel);
        accessibility.put("screen_reader_optimized", true);
        accessibility.put("keyboard_accessible", true);
        accessibility.put("high_contrast_available", true);
        accessibility.set("context", mapper.valueToTree(context.toMap()));

        if (body.get("error") instanceof ObjectNode error && error.get("message") != null
                && error.get("message").isTextual()) {
            String message = error.get("message").asText();
            error.put("screen_reader_message", screenReaderMessage(message));
            error.put("user_friendly_message", userFriendlyMessage(message));
        }
        return response.withBody(mapper.writeValueAsBytes(body));
    }

    /** Canned sentence for the first status code found in the message, else the message. */
    public static String screenReaderMessage(String message) {
        for (Map.Entry<String, String> entry : SCREEN_READER_MESSAGES.entrySet()) {
            if (message.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return message;
    }

    /** Canned sentence for the first trigger phrase found in the message, else the message. */
    public static String userFriendlyMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : USER_FRIENDLY_MESSAGES.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return message;
    }

    private static Map<String, String> orderedMap(String... keysAndValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
