package com.voucherpay.eventmodel;

/**
 * Product areas used to classify requests for impact reporting.
 */
public enum FeatureArea {

    SOCIAL_SECURITY("social_security"),
    HOUSING("housing"),
    BUSINESS_FUNDING("business_funding"),
    JOBS("jobs"),
    NON_DISCRIMINATION("non_discrimination"),
    ACCESSIBILITY("accessibility"),
    AI_ASSISTANCE("ai_assistance");

    private final String key;

    FeatureArea(String key) {
        this.key = key;
    }

    /** The snake_case name used in serialized events. */
    public String key() {
        return key;
    }
}
