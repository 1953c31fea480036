package com.voucherpay.eventmodel;

import java.util.ArrayList;

/**
 * Checks an {@link AnalyticsEvent} for required fields and internally consistent derived flags.
 * All errors are collected at once.
 */
public final class EventValidator {

    private EventValidator() {
        // utility class
    }

    public static ValidationResult validate(AnalyticsEvent event) {
        var errors = new ArrayList<String>();

        if (isBlank(event.eventId())) {
            errors.add("eventId must not be null or blank");
        }
        if (isBlank(event.eventType())) {
            errors.add("eventType must not be null or blank");
        }
        if (event.occurredAt() == null) {
            errors.add("occurredAt must not be null");
        }
        if (event.request() == null) {
            errors.add("request must not be null");
        } else {
            if (isBlank(event.request().method())) {
                errors.add("request.method must not be null or blank");
            }
            if (event.request().path() == null) {
                errors.add("request.path must not be null");
            }
        }
        if (event.response() == null) {
            errors.add("response must not be null");
        } else {
            int status = event.response().statusCode();
            if (status < 100 || status > 599) {
                errors.add("response.statusCode must be between 100 and 599");
            }
            if (event.response().success() != ResponseInfo.isSuccessStatus(status)) {
                errors.add("response.success does not match response.statusCode");
            }
        }
        if (event.accessibility() == null) {
            errors.add("accessibility must not be null");
        }
        if (event.empowerment() == null) {
            errors.add("empowerment must not be null");
        }
        if (event.impact() == null) {
            errors.add("impact must not be null");
        } else if (event.impact().any() && event.response() != null && !event.response().success()) {
            errors.add("impact indicators must all be false for an unsuccessful response");
        }

        return ValidationResult.of(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
