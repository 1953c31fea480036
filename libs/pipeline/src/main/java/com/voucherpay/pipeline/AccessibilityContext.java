package com.voucherpay.pipeline;

import com.voucherpay.eventmodel.AccessibilityFlags;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of the client's declared accessibility needs for one request.
 *
 * @param screenReader       client is driven by a screen reader
 * @param highContrast       high-contrast rendering requested
 * @param reducedMotion      reduced motion requested
 * @param keyboardNavigation keyboard-only navigation
 * @param fontSize           preferred base font size in pixels
 * @param language           {@code Accept-Language} value
 * @param userAgent          {@code User-Agent} value, empty when absent
 */
public record AccessibilityContext(
        boolean screenReader,
        boolean highContrast,
        boolean reducedMotion,
        boolean keyboardNavigation,
        int fontSize,
        String language,
        String userAgent) {

    public static final int DEFAULT_FONT_SIZE = 16;
    public static final String DEFAULT_LANGUAGE = "en";

    public static final AccessibilityContext DEFAULT =
            new AccessibilityContext(false, false, false, false, DEFAULT_FONT_SIZE, DEFAULT_LANGUAGE, "");

    public AccessibilityContext {
        if (fontSize <= 0) {
            fontSize = DEFAULT_FONT_SIZE;
        }
        if (language == null || language.isBlank()) {
            language = DEFAULT_LANGUAGE;
        }
        userAgent = userAgent == null ? "" : userAgent;
    }

    public AccessibilityFlags flags() {
        return new AccessibilityFlags(screenReader, highContrast, reducedMotion, keyboardNavigation);
    }

    /** The context as it appears under {@code _accessibility.context} in enriched bodies. */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("screen_reader", screenReader);
        map.put("high_contrast", highContrast);
        map.put("reduced_motion", reducedMotion);
        map.put("keyboard_navigation", keyboardNavigation);
        map.put("font_size", fontSize);
        map.put("language", language);
        map.put("user_agent", userAgent);
        return map;
    }
}
