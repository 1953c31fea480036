package com.voucherpay.eventmodel;

/**
 * An {@link AnalyticsSink} could not accept an event: it is full, too slow or down.
 */
public class SinkUnavailableException extends RuntimeException {

    public SinkUnavailableException(String message) {
        super(message);
    }

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
