package com.voucherpay.eventmodel;

/**
 * Destination for {@link AnalyticsEvent}s.
 * <p>
 * Implementations must be safe for concurrent use. Callers treat emission as best effort:
 * a failure is logged and the event dropped.
 */
@FunctionalInterface
public interface AnalyticsSink {

    /**
     * Hands one event to the sink.
     *
     * @throws SinkUnavailableException if the sink cannot accept the event right now
     */
    void emit(AnalyticsEvent event);
}
