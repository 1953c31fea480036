package com.voucherpay.pipeline;

/**
 * Derives the {@link AccessibilityContext} from request headers.
 * <p>
 * A boolean flag is set only when its header is exactly {@code true}. A missing or
 * non-numeric {@code X-Font-Size} yields 16; a missing {@code Accept-Language} yields "en".
 */
public class RequestContextExtractor implements RequestStage {

    public static final String SCREEN_READER = "X-Screen-Reader";
    public static final String HIGH_CONTRAST = "X-High-Contrast";
    public static final String REDUCED_MOTION = "X-Reduced-Motion";
    public static final String KEYBOARD_NAVIGATION = "X-Keyboard-Navigation";
    public static final String FONT_SIZE = "X-Font-Size";
    public static final String ACCEPT_LANGUAGE = "Accept-Language";
    public static final String USER_AGENT = "User-Agent";

    @Override
    public void beforeHandler(PipelineExchange exchange) {
        exchange.accessibilityContext(extract(exchange.request()));
    }

    public AccessibilityContext extract(PipelineRequest request) {
        return new AccessibilityContext(
                flag(request, SCREEN_READER),
                flag(request, HIGH_CONTRAST),
                flag(request, REDUCED_MOTION),
                flag(request, KEYBOARD_NAVIGATION),
                fontSize(request),
                request.header(ACCEPT_LANGUAGE).map(String::strip).orElse(AccessibilityContext.DEFAULT_LANGUAGE),
                request.header(USER_AGENT).orElse(""));
    }

    private static boolean flag(PipelineRequest request, String header) {
        return request.header(header).map("true"::equals).orElse(false);
    }

    private static int fontSize(PipelineRequest request) {
        return request.header(FONT_SIZE)
                .map(String::strip)
                .map(RequestContextExtractor::parsePositive)
                .orElse(AccessibilityContext.DEFAULT_FONT_SIZE);
    }

    private static int parsePositive(String value) {
        try {
            int size = Integer.parseInt(value);
            return size > 0 ? size : AccessibilityContext.DEFAULT_FONT_SIZE;
        } catch (NumberFormatException e) {
            return AccessibilityContext.DEFAULT_FONT_SIZE;
        }
    }
}
