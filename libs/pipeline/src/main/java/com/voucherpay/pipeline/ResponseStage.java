package com.voucherpay.pipeline;

/**
 * A stage that runs after the handler returned and may replace the response.
 * <p>
 * Stages must not assume any other stage ran. A stage that throws is skipped: the pipeline
 * keeps the response it was given.
 */
@FunctionalInterface
public interface ResponseStage {

    /**
     * @param exchange the request-scoped state
     * @param response the response produced by the handler or the previous stage
     * @return the response to hand to the next stage
     */
    PipelineResponse afterHandler(PipelineExchange exchange, PipelineResponse response);
}
