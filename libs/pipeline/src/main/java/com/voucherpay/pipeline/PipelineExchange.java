package com.voucherpay.pipeline;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-scoped state shared by the stages of one pipeline execution.
 * <p>
 * Owned by a single request thread; not safe for concurrent use.
 */
public final class PipelineExchange {

    public static final String SESSION_ID_HEADER = "X-Session-ID";

    private final PipelineRequest request;
    private final Instant receivedAt;
    private final long startNanos;
    private AccessibilityContext accessibilityContext = AccessibilityContext.DEFAULT;
    private String userId;
    private String correlationId;

    private PipelineExchange(PipelineRequest request, Instant receivedAt, long startNanos) {
        this.request = Objects.requireNonNull(request, "request");
        this.receivedAt = receivedAt;
        this.startNanos = startNanos;
    }

    /** Starts an exchange now. */
    public static PipelineExchange start(PipelineRequest request, Clock clock) {
        return new PipelineExchange(request, clock.instant(), System.nanoTime());
    }

    public PipelineRequest request() {
        return request;
    }

    public Instant receivedAt() {
        return receivedAt;
    }

    /** Nanoseconds elapsed since the exchange started. */
    public long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    public AccessibilityContext accessibilityContext() {
        return accessibilityContext;
    }

    public void accessibilityContext(AccessibilityContext context) {
        this.accessibilityContext = Objects.requireNonNull(context, "context");
    }

    /** Subject of the verified access token, once a handler has authenticated the caller. */
    public Optional<String> userId() {
        return Optional.ofNullable(userId);
    }

    public void bindUser(String userId) {
        this.userId = userId;
    }

    public Optional<String> sessionId() {
        return request.header(SESSION_ID_HEADER).filter(s -> !s.isBlank());
    }

    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    public void correlationId(String correlationId) {
        this.correlationId = correlationId;
    }
}
