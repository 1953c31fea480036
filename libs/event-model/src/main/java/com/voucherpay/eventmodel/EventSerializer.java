package com.voucherpay.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Wire form of {@link AnalyticsEvent}: snake_case keys, ISO 8601 instants, durations as
 * decimal seconds ({@code "process_time": 0.125}), and the derived {@code features_accessed}
 * and {@code accessibility_score} fields alongside the flags they come from.
 */
public final class EventSerializer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private EventSerializer() {
    }

    /** One-line JSON document for the event. */
    public static String serialize(AnalyticsEvent event) {
        try {
            return MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException(event.eventId(), e);
        }
    }

    /** The event as a mutable JSON tree, for sinks that add envelope fields before writing. */
    public static ObjectNode toTree(AnalyticsEvent event) {
        try {
            return MAPPER.valueToTree(event);
        } catch (IllegalArgumentException e) {
            throw new EventSerializationException(event.eventId(), e);
        }
    }

    static ObjectMapper mapper() {
        return MAPPER;
    }

    /** Raised when an event cannot be written, which means a model class is not serializable. */
    public static class EventSerializationException extends RuntimeException {
        EventSerializationException(String eventId, Throwable cause) {
            super("Cannot serialize analytics event " + eventId, cause);
        }
    }
}
