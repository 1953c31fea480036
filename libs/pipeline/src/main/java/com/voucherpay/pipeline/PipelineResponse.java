package com.voucherpay.pipeline;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable snapshot of a handler's response as it moves through the response stages.
 * <p>
 * {@link #headers()} holds only the headers added by stages; the handler's own headers stay
 * on the underlying framework response untouched.
 *
 * @param status      HTTP status
 * @param contentType content type (nullable)
 * @param body        raw body bytes
 * @param headers     headers added by response stages, in insertion order
 */
public record PipelineResponse(int status, String contentType, byte[] body, Map<String, String> headers) {

    public PipelineResponse {
        body = body == null ? new byte[0] : body.clone();
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public PipelineResponse(int status, String contentType, byte[] body) {
        this(status, contentType, body, Map.of());
    }

    public static PipelineResponse json(int status, String json) {
        return new PipelineResponse(status, "application/json", json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] body() {
        return body.clone();
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /** True for {@code application/json} and {@code application/*+json} content types. */
    public boolean isJson() {
        if (contentType == null) {
            return false;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) {
            type = type.substring(0, semicolon);
        }
        type = type.strip();
        return type.equals("application/json") || (type.startsWith("application/") && type.endsWith("+json"));
    }

    public PipelineResponse withBody(byte[] newBody) {
        return new PipelineResponse(status, contentType, newBody, headers);
    }

    public PipelineResponse withHeader(String name, String value) {
        var copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new PipelineResponse(status, contentType, body, copy);
    }

    @Override
    public String toString() {
        return "PipelineResponse[status=%d, contentType=%s, bodyBytes=%d, headers=%s]"
                .formatted(status, contentType, body.length, headers.keySet());
    }
}
