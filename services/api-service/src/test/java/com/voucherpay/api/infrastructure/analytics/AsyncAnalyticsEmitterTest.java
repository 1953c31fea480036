package com.voucherpay.api.infrastructure.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

import com.voucherpay.eventmodel.AccessibilityFlags;
import com.voucherpay.eventmodel.AnalyticsEvent;
import com.voucherpay.eventmodel.AnalyticsSink;
import com.voucherpay.eventmodel.EmpowermentFeatureFlags;
import com.voucherpay.eventmodel.ImpactIndicators;
import com.voucherpay.eventmodel.RequestInfo;
import com.voucherpay.eventmodel.ResponseInfo;
import com.voucherpay.eventmodel.SinkUnavailableException;
import com.voucherpay.observability.CorrelationContextHolder;
import com.voucherpay.observability.MetricFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@DisplayName("AsyncAnalyticsEmitter")
class AsyncAnalyticsEmitterTest {

    private final MetricFactory metrics = MetricFactory.standalone("emitter-test");
    private final CountDownLatch release = new CountDownLatch(1);
    private ThreadPoolTaskExecutor executor;
    private AsyncAnalyticsEmitter emitter;

    @AfterEach
    void shutdown() {
        release.countDown();
        if (executor != null) {
            executor.shutdown();
        }
    }

    private AsyncAnalyticsEmitter emitter(AnalyticsSink delegate, int capacity) {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(capacity);
        executor.setThreadNamePrefix("analytics-test-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return new AsyncAnalyticsEmitter(delegate, executor, metrics);
    }

    private AnalyticsSink stalled(CountDownLatch started) {
        return e -> {
            started.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        };
    }

    private static AnalyticsEvent event(String correlationId) {
        Instant at = Instant.parse("2026-03-01T12:00:00Z");
        return AnalyticsEvent.apiRequest(
                at,
                new RequestInfo("GET", "http://localhost/api/v1/jobs", "/api/v1/jobs", Map.of(), "", "", at),
                ResponseInfo.of(200, Duration.ofMillis(5)),
                AccessibilityFlags.NONE,
                EmpowermentFeatureFlags.none(),
                ImpactIndicators.NONE,
                null,
                null,
                correlationId);
    }

    private double dropped() {
        var counter = metrics.registry().find("analytics.events.dropped").tag("reason", "delivery_failed").counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    @DisplayName("delivers events on the worker with the event's correlation id in context")
    void deliversWithCorrelation() throws Exception {
        List<String> seenCorrelation = new CopyOnWriteArrayList<>();
        CountDownLatch delivered = new CountDownLatch(2);
        emitter = emitter(e -> {
            seenCorrelation.add(CorrelationContextHolder.get().map(c -> c.correlationId()).orElse("none"));
            delivered.countDown();
        }, 10);

        emitter.emit(event("corr-a"));
        emitter.emit(event(null));

        assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seenCorrelation).containsExactly("corr-a", "none");
    }

    @Test
    @DisplayName("refuses with SinkUnavailableException once the queue is full")
    void rejectsWhenFull() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        emitter = emitter(stalled(started), 1);

        emitter.emit(event("first"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        emitter.emit(event("queued"));

        assertThatThrownBy(() -> emitter.emit(event("overflow")))
                .isInstanceOf(SinkUnavailableException.class)
                .hasMessageContaining("queue full");
        assertThat(emitter.pending()).isEqualTo(1);
        assertThat(metrics.registry().get("analytics.queue.depth").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("never makes the caller wait on a stalled sink")
    void doesNotBlockCaller() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        emitter = emitter(stalled(started), 1);
        emitter.emit(event("first"));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertTimeout(Duration.ofMillis(200), () -> {
            emitter.emit(event("queued"));
            for (int i = 0; i < 3; i++) {
                assertThatThrownBy(() -> emitter.emit(event("overflow")))
                        .isInstanceOf(SinkUnavailableException.class);
            }
        });
    }

    @Test
    @DisplayName("counts delegate failures as dropped and keeps draining")
    void countsDeliveryFailures() throws Exception {
        CountDownLatch secondDelivered = new CountDownLatch(1);
        emitter = emitter(e -> {
            if ("bad".equals(e.correlationId())) {
                throw new IllegalStateException("sink down");
            }
            secondDelivered.countDown();
        }, 10);

        emitter.emit(event("bad"));
        emitter.emit(event("good"));

        assertThat(secondDelivered.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(dropped()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("rejects events after the executor shuts down")
    void rejectsAfterShutdown() {
        emitter = emitter(e -> {}, 10);
        executor.shutdown();

        assertThatThrownBy(() -> emitter.emit(event("late"))).isInstanceOf(SinkUnavailableException.class);
    }
}
