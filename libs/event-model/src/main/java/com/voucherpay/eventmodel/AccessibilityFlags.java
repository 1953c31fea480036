package com.voucherpay.eventmodel;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Assistive-technology preferences a client declared on a single request.
 *
 * @param screenReader       {@code X-Screen-Reader: true}
 * @param highContrast       {@code X-High-Contrast: true}
 * @param reducedMotion      {@code X-Reduced-Motion: true}
 * @param keyboardNavigation {@code X-Keyboard-Navigation: true}
 */
public record AccessibilityFlags(
        boolean screenReader,
        boolean highContrast,
        boolean reducedMotion,
        boolean keyboardNavigation) {

    private static final int FLAG_COUNT = 4;

    public static final AccessibilityFlags NONE = new AccessibilityFlags(false, false, false, false);

    /** True if the client asked for at least one accommodation. */
    public boolean anyEnabled() {
        return enabledCount() > 0;
    }

    /** Fraction of the flags that are set, between 0.0 and 1.0. */
    @JsonProperty("accessibility_score")
    public double usageScore() {
        return (double) enabledCount() / FLAG_COUNT;
    }

    private int enabledCount() {
        int count = 0;
        if (screenReader) {
            count++;
        }
        if (highContrast) {
            count++;
        }
        if (reducedMotion) {
            count++;
        }
        if (keyboardNavigation) {
            count++;
        }
        return count;
    }
}
