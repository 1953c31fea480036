package com.voucherpay.pipeline;

import com.voucherpay.observability.MetricFactory;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs request stages, the handler and response stages in strict order for one request.
 * <p>
 * Each response stage receives the output of the previous one, so enrichment sees the
 * handler's final response and analytics sees the enriched one. A stage that throws is
 * logged and skipped. If the handler throws, or the thread was interrupted while it ran,
 * no response stage runs and the failure propagates.
 */
public class MiddlewarePipeline {

    private static final Logger log = LoggerFactory.getLogger(MiddlewarePipeline.class);

    private final List<RequestStage> requestStages;
    private final List<ResponseStage> responseStages;
    private final Timer duration;

    public MiddlewarePipeline(List<RequestStage> requestStages, List<ResponseStage> responseStages, MetricFactory metrics) {
        this.requestStages = List.copyOf(requestStages);
        this.responseStages = List.copyOf(responseStages);
        this.duration = metrics.timer("pipeline.request.duration", "Time spent handling a request inside the pipeline");
    }

    /**
     * The standard order: context extraction, handler, enrichment, analytics.
     * Either post-handler stage may be null when disabled.
     */
    public static MiddlewarePipeline standard(
            RequestContextExtractor extractor,
            ResponseEnrichmentStage enrichment,
            AnalyticsDerivationStage analytics,
            MetricFactory metrics) {
        var after = new ArrayList<ResponseStage>();
        if (enrichment != null) {
            after.add(enrichment);
        }
        if (analytics != null) {
            after.add(analytics);
        }
        return new MiddlewarePipeline(List.of(extractor), after, metrics);
    }

    /**
     * Executes the pipeline around {@code handler}.
     *
     * @return the response after every response stage
     * @throws HandlerCancelledException if the request was cancelled while the handler ran
     * @throws Exception                 whatever the handler threw
     */
    public PipelineResponse execute(PipelineExchange exchange, Handler handler) throws Exception {
        try {
            for (RequestStage stage : requestStages) {
                runRequestStage(stage, exchange);
            }

            PipelineResponse response = handler.handle(exchange);
            if (Thread.currentThread().isInterrupted()) {
                throw new HandlerCancelledException("Request cancelled while the handler was running");
            }
            if (response == null) {
                throw new IllegalStateException("handler returned no response");
            }

            for (ResponseStage stage : responseStages) {
                response = runResponseStage(stage, exchange, response);
            }
            return response;
        } finally {
            duration.record(exchange.elapsedNanos(), TimeUnit.NANOSECONDS);
        }
    }

    private static void runRequestStage(RequestStage stage, PipelineExchange exchange) {
        try {
            stage.beforeHandler(exchange);
        } catch (RuntimeException e) {
            log.warn("Request stage {} failed, continuing with defaults", stage.getClass().getSimpleName(), e);
        }
    }

    private static PipelineResponse runResponseStage(
            ResponseStage stage, PipelineExchange exchange, PipelineResponse response) {
        try {
            PipelineResponse next = stage.afterHandler(exchange, response);
            return next != null ? next : response;
        } catch (RuntimeException e) {
            log.warn("Response stage {} failed, passing the response through", stage.getClass().getSimpleName(), e);
            return response;
        }
    }

    public List<RequestStage> requestStages() {
        return requestStages;
    }

    public List<ResponseStage> responseStages() {
        return responseStages;
    }
}
