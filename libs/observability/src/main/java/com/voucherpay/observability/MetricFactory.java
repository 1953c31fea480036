package com.voucherpay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.function.ToDoubleFunction;

/**
 * Builds Micrometer meters tagged with {@code service=<name>}.
 * <p>
 * The pipeline stages and the analytics emitter get their meters here so that names and tags
 * stay uniform. Micrometer returns the already-registered meter when the same name and tags
 * are requested twice, so callers may ask repeatedly.
 */
public final class MetricFactory {

    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** A factory over its own {@link SimpleMeterRegistry}, for code running without Spring. */
    public static MetricFactory standalone(String serviceName) {
        return new MetricFactory(new SimpleMeterRegistry(), serviceName);
    }

    /**
     * @param tags extra tags as alternating keys and values
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name).description(description).tags(tagsWith(tags)).register(registry);
    }

    /**
     * @param tags extra tags as alternating keys and values
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name).description(description).tags(tagsWith(tags)).register(registry);
    }

    /**
     * Registers a gauge that samples {@code source} whenever the registry is scraped. The
     * registry holds {@code source} weakly; keep a reference for as long as the gauge matters.
     */
    public <T> Gauge gauge(String name, String description, T source, ToDoubleFunction<T> value, String... tags) {
        return Gauge.builder(name, source, value).description(description).tags(tagsWith(tags)).register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tagsWith(String... extra) {
        if (extra.length % 2 != 0) {
            throw new IllegalArgumentException("tags must be key/value pairs, got " + extra.length + " values");
        }
        return Tags.of(TAG_SERVICE, serviceName).and(extra);
    }
}
