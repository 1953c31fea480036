package com.voucherpay.api.infrastructure.web;

import com.voucherpay.observability.CorrelationContext;
import com.voucherpay.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation id for every HTTP request and carries the client's
 * session id alongside it.
 *
 * <p>Both ids go into {@link CorrelationContextHolder} (and so the SLF4J MDC) for the duration
 * of the request and are echoed on the response. Values that are too long or contain
 * characters outside {@code [A-Za-z0-9._:-]} are not trusted: a fresh correlation id is
 * generated and the session id is dropped. Runs first so every later filter logs with them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String SESSION_ID_HEADER = "X-Session-ID";

    static final int MAX_ID_LENGTH = 128;

    // Ids end up in log lines and response headers; anything else is replaced.
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1," + MAX_ID_LENGTH + "}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = safeId(request.getHeader(CORRELATION_ID_HEADER))
                .orElseGet(() -> UUID.randomUUID().toString());
        String sessionId = safeId(request.getHeader(SESSION_ID_HEADER)).orElse(null);

        CorrelationContextHolder.set(
                new CorrelationContext(correlationId, sessionId, null, UUID.randomUUID().toString()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        if (sessionId != null) {
            response.setHeader(SESSION_ID_HEADER, sessionId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    /** The header value if it is a plausible id, otherwise empty. */
    static Optional<String> safeId(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        String trimmed = headerValue.strip();
        return SAFE_ID.matcher(trimmed).matches() ? Optional.of(trimmed) : Optional.empty();
    }
}
