package com.voucherpay.pipeline;

/**
 * A stage that runs before the handler and may record request-scoped state on the exchange.
 */
@FunctionalInterface
public interface RequestStage {

    void beforeHandler(PipelineExchange exchange);
}
