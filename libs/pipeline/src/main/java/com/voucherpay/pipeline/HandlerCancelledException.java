package com.voucherpay.pipeline;

/**
 * The request was cancelled or timed out before the handler produced a response.
 */
public class HandlerCancelledException extends RuntimeException {

    public HandlerCancelledException(String message) {
        super(message);
    }

    public HandlerCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
