package com.voucherpay.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identifiers that follow one inbound HTTP request through the logs.
 * <p>
 * Created by the outermost web filter; {@link #userId()} is filled in once an access token
 * has been verified.
 *
 * @param correlationId {@code X-Correlation-ID} from the caller, or generated. Required.
 * @param sessionId     client session from {@code X-Session-ID} (nullable)
 * @param userId        subject of a verified access token (nullable)
 * @param requestId     id of this request alone (nullable)
 */
public record CorrelationContext(String correlationId, String sessionId, String userId, String requestId) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    /** Every MDC key a context may write. */
    public static final List<String> MDC_KEYS =
            List.of(MDC_CORRELATION_ID, MDC_SESSION_ID, MDC_USER_ID, MDC_REQUEST_ID);

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, sessionId, userId, requestId);
    }

    /** The non-null identifiers keyed by their MDC names. */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        if (sessionId != null) {
            entries.put(MDC_SESSION_ID, sessionId);
        }
        if (userId != null) {
            entries.put(MDC_USER_ID, userId);
        }
        if (requestId != null) {
            entries.put(MDC_REQUEST_ID, requestId);
        }
        return entries;
    }
}
