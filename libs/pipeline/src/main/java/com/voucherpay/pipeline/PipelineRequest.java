package com.voucherpay.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Framework-neutral view of an inbound HTTP request.
 *
 * @param method        HTTP method
 * @param url           full URL including the query string
 * @param path          request path without the query string
 * @param queryParams   first value of each query parameter, in request order
 * @param headers       request headers; lookups ignore case
 * @param remoteAddress client address (nullable)
 */
public record PipelineRequest(
        String method,
        String url,
        String path,
        Map<String, String> queryParams,
        Map<String, String> headers,
        String remoteAddress) {

    public PipelineRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        path = path == null ? "" : path;
        url = url == null ? path : url;
        queryParams = queryParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        var caseInsensitive = new TreeMap<String, String>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        headers = Collections.unmodifiableMap(caseInsensitive);
    }

    /** Returns the header value, if present. */
    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }
}
