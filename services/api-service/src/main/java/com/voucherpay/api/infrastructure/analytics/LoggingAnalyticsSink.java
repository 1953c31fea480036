package com.voucherpay.api.infrastructure.analytics;

import com.voucherpay.eventmodel.AnalyticsEvent;
import com.voucherpay.eventmodel.AnalyticsSink;
import com.voucherpay.eventmodel.EventSerializer;
import com.voucherpay.eventmodel.EventValidator;
import com.voucherpay.eventmodel.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each event as one JSON line to the {@code voucherpay.analytics} logger. Events that
 * fail validation are still written, preceded by a warning listing what is wrong.
 */
public class LoggingAnalyticsSink implements AnalyticsSink {

    static final String LOGGER_NAME = "voucherpay.analytics";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void emit(AnalyticsEvent event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            log.warn("Inconsistent analytics event {}: {}", event.eventId(), validation.summary());
        }
        if (log.isInfoEnabled()) {
            log.info("Analytics Event: {}", EventSerializer.serialize(event));
        }
    }
}
