package com.voucherpay.eventmodel;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound request metadata captured for analytics.
 *
 * @param method      HTTP method
 * @param url         full request URL including the query string
 * @param path        request path
 * @param queryParams query parameters, sensitive values already redacted
 * @param userAgent   {@code User-Agent} header, empty when absent
 * @param ipAddress   client address (nullable)
 * @param timestamp   when the request arrived
 */
public record RequestInfo(
        String method,
        String url,
        String path,
        Map<String, Object> queryParams,
        String userAgent,
        String ipAddress,
        Instant timestamp) {

    public RequestInfo {
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        userAgent = userAgent == null ? "" : userAgent;
    }
}
