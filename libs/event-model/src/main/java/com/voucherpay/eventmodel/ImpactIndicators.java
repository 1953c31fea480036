package com.voucherpay.eventmodel;

/**
 * Derived outcome flags for one request. All three are false for unsuccessful responses.
 *
 * @param barrierReduced      an accessibility accommodation was used to reach a feature area
 * @param opportunityAccessed the request reached jobs, funding, housing or grants
 * @param supportProvided     the request reached assistance, support, help or AI recommendations
 */
public record ImpactIndicators(boolean barrierReduced, boolean opportunityAccessed, boolean supportProvided) {

    public static final ImpactIndicators NONE = new ImpactIndicators(false, false, false);

    public boolean any() {
        return barrierReduced || opportunityAccessed || supportProvided;
    }
}
