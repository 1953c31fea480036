package com.voucherpay.eventmodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * One structured record per handled request, describing who asked for what, how it went,
 * and which accessibility and empowerment outcomes it represents.
 * <p>
 * Built once after the response is final and handed to an {@link AnalyticsSink}; never
 * mutated afterwards.
 *
 * @param eventId       unique identifier (UUID v4)
 * @param eventType     always {@link #API_REQUEST} for pipeline events
 * @param occurredAt    when the event was built
 * @param request       inbound request metadata
 * @param response      final response metadata
 * @param accessibility accommodations the client declared
 * @param empowerment   feature areas the request path touched
 * @param impact        derived outcome flags
 * @param userId        subject of a verified access token (nullable)
 * @param sessionId     {@code X-Session-ID} header (nullable)
 * @param correlationId request correlation id (nullable)
 */
public record AnalyticsEvent(
        String eventId,
        String eventType,
        Instant occurredAt,
        RequestInfo request,
        ResponseInfo response,
        AccessibilityFlags accessibility,
        EmpowermentFeatureFlags empowerment,
        ImpactIndicators impact,
        String userId,
        String sessionId,
        String correlationId) {

    public static final String API_REQUEST = "api_request";

    /**
     * Creates an {@link #API_REQUEST} event with a generated id.
     */
    public static AnalyticsEvent apiRequest(
            Instant occurredAt,
            RequestInfo request,
            ResponseInfo response,
            AccessibilityFlags accessibility,
            EmpowermentFeatureFlags empowerment,
            ImpactIndicators impact,
            String userId,
            String sessionId,
            String correlationId) {
        return new AnalyticsEvent(
                UUID.randomUUID().toString(),
                API_REQUEST,
                occurredAt,
                request,
                response,
                accessibility,
                empowerment,
                impact,
                userId,
                sessionId,
                correlationId);
    }

    /** Number of feature areas touched. */
    @JsonProperty("features_accessed")
    public int featuresAccessed() {
        return empowerment == null ? 0 : empowerment.featuresAccessed();
    }
}
