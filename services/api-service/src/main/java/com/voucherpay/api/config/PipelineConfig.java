package com.voucherpay.api.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voucherpay.api.infrastructure.analytics.AsyncAnalyticsEmitter;
import com.voucherpay.api.infrastructure.analytics.LoggingAnalyticsSink;
import com.voucherpay.observability.MetricFactory;
import com.voucherpay.observability.SensitiveDataRedactor;
import com.voucherpay.pipeline.AnalyticsDerivationStage;
import com.voucherpay.pipeline.MiddlewarePipeline;
import com.voucherpay.pipeline.RequestContextExtractor;
import com.voucherpay.pipeline.ResponseEnrichmentStage;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Assembles the middleware pipeline: context extraction, then (after the handler) response
 * enrichment and analytics derivation, each switchable by configuration.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    /**
     * One delivery thread behind a bounded queue; a full queue rejects instead of blocking.
     * On shutdown queued events get {@code emit-timeout} to drain.
     */
    @Bean
    public ThreadPoolTaskExecutor analyticsExecutor(AnalyticsProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.queueCapacity());
        executor.setThreadNamePrefix("analytics-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(properties.emitTimeout().toMillis());
        return executor;
    }

    @Bean
    public AsyncAnalyticsEmitter analyticsSink(ThreadPoolTaskExecutor analyticsExecutor, MetricFactory metrics) {
        return new AsyncAnalyticsEmitter(new LoggingAnalyticsSink(), analyticsExecutor, metrics);
    }

    @Bean
    public MiddlewarePipeline middlewarePipeline(
            AccessibilityProperties accessibility,
            AnalyticsProperties analytics,
            AsyncAnalyticsEmitter sink,
            SensitiveDataRedactor redactor,
            ObjectMapper objectMapper,
            Clock clock,
            MetricFactory metrics) {
        ResponseEnrichmentStage enrichment = accessibility.enabled()
                ? new ResponseEnrichmentStage(objectMapper, accessibility.wcagLevel(), metrics)
                : null;
        AnalyticsDerivationStage derivation = analytics.enabled()
                ? new AnalyticsDerivationStage(sink, clock, redactor, metrics)
                : null;
        log.info("Middleware pipeline: enrichment={}, analytics={}", enrichment != null, derivation != null);
        return MiddlewarePipeline.standard(new RequestContextExtractor(), enrichment, derivation, metrics);
    }
}
