package com.voucherpay.pipeline;

/**
 * The request handler wrapped by the pipeline; opaque to every stage.
 */
@FunctionalInterface
public interface Handler {

    /**
     * @throws HandlerCancelledException if the request was cancelled before a response existed
     * @throws Exception                 any handler failure; propagated unchanged by the pipeline
     */
    PipelineResponse handle(PipelineExchange exchange) throws Exception;
}
