package com.voucherpay.api.infrastructure.analytics;

import com.voucherpay.eventmodel.AnalyticsEvent;
import com.voucherpay.eventmodel.AnalyticsSink;
import com.voucherpay.eventmodel.SinkUnavailableException;
import com.voucherpay.observability.CorrelationContext;
import com.voucherpay.observability.CorrelationContextHolder;
import com.voucherpay.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Decouples request threads from a possibly slow {@link AnalyticsSink}.
 * <p>
 * {@link #emit(AnalyticsEvent)} hands the event to a bounded executor and returns at once. When
 * the executor's queue is full, or it has been shut down, the event is refused with
 * {@link SinkUnavailableException}. Delivery runs with the event's correlation id in the MDC.
 */
public class AsyncAnalyticsEmitter implements AnalyticsSink {

    private static final Logger log = LoggerFactory.getLogger(AsyncAnalyticsEmitter.class);

    private final AnalyticsSink delegate;
    private final ThreadPoolTaskExecutor executor;
    private final Counter deliveryFailures;

    /**
     * @param delegate the sink that does the actual delivery
     * @param executor an initialized executor; its queue capacity bounds the backlog
     */
    public AsyncAnalyticsEmitter(AnalyticsSink delegate, ThreadPoolTaskExecutor executor, MetricFactory metrics) {
        this.delegate = delegate;
        this.executor = executor;
        this.deliveryFailures = metrics.counter(
                "analytics.events.dropped", "Analytics events dropped", "reason", "delivery_failed");
        metrics.gauge("analytics.queue.depth", "Analytics events waiting for delivery",
                executor, AsyncAnalyticsEmitter::queueDepth);
    }

    @Override
    public void emit(AnalyticsEvent event) {
        try {
            executor.execute(() -> deliver(event));
        } catch (TaskRejectedException e) {
            log.debug("Analytics executor refused event {}", event.eventId());
            throw new SinkUnavailableException("analytics queue full or shut down", e);
        }
    }

    /** Events waiting for the worker. */
    public int pending() {
        return (int) queueDepth(executor);
    }

    private void deliver(AnalyticsEvent event) {
        CorrelationContext context = event.correlationId() == null
                ? null
                : new CorrelationContext(event.correlationId(), event.sessionId(), event.userId(), null);
        CorrelationContextHolder.runWithContext(context, () -> {
            try {
                delegate.emit(event);
            } catch (RuntimeException e) {
                deliveryFailures.increment();
                log.warn("Dropping analytics event {}: {}", event.eventId(), e.getMessage());
            }
        });
    }

    private static double queueDepth(ThreadPoolTaskExecutor executor) {
        try {
            return executor.getThreadPoolExecutor().getQueue().size();
        } catch (IllegalStateException notInitialized) {
            return 0;
        }
    }
}
