package com.voucherpay.api.infrastructure.web;

import com.voucherpay.observability.CorrelationContext;
import com.voucherpay.observability.CorrelationContextHolder;
import com.voucherpay.pipeline.MiddlewarePipeline;
import com.voucherpay.pipeline.PipelineExchange;
import com.voucherpay.pipeline.PipelineRequest;
import com.voucherpay.pipeline.PipelineResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Binds the servlet request to the {@link MiddlewarePipeline}.
 *
 * <p>The response is buffered so the pipeline can replace the body and add headers before
 * anything is committed. The {@link PipelineExchange} is published as a request attribute so
 * handlers can attach the authenticated user to it. {@code X-Process-Time} (seconds) is set
 * last. Actuator endpoints bypass the pipeline.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class MiddlewarePipelineFilter extends OncePerRequestFilter {

    public static final String EXCHANGE_ATTRIBUTE = PipelineExchange.class.getName();
    public static final String PROCESS_TIME_HEADER = "X-Process-Time";

    private final MiddlewarePipeline pipeline;
    private final Clock clock;

    public MiddlewarePipelineFilter(MiddlewarePipeline pipeline, Clock clock) {
        this.pipeline = pipeline;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith(request.getContextPath() + "/actuator");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        PipelineExchange exchange = PipelineExchange.start(toPipelineRequest(request), clock);
        CorrelationContextHolder.get().map(CorrelationContext::correlationId).ifPresent(exchange::correlationId);
        request.setAttribute(EXCHANGE_ATTRIBUTE, exchange);

        var buffered = new ContentCachingResponseWrapper(response);
        try {
            PipelineResponse result = pipeline.execute(exchange, ex -> {
                filterChain.doFilter(request, buffered);
                return new PipelineResponse(buffered.getStatus(), buffered.getContentType(), buffered.getContentAsByteArray());
            });
            apply(result, buffered);
        } catch (IOException | ServletException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ServletException(e);
        } finally {
            buffered.setHeader(PROCESS_TIME_HEADER, processTime(exchange.elapsedNanos()));
            buffered.copyBodyToResponse();
        }
    }

    private static void apply(PipelineResponse result, ContentCachingResponseWrapper buffered) throws IOException {
        result.headers().forEach(buffered::setHeader);
        byte[] body = result.body();
        if (!Arrays.equals(body, buffered.getContentAsByteArray())) {
            buffered.resetBuffer();
            buffered.getOutputStream().write(body);
        }
    }

    static PipelineRequest toPipelineRequest(HttpServletRequest request) {
        String query = request.getQueryString();
        String url = request.getRequestURL() + (query != null ? "?" + query : "");

        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.putIfAbsent(name, request.getHeader(name));
        }

        return new PipelineRequest(
                request.getMethod(),
                url,
                request.getRequestURI(),
                queryParams(query),
                headers,
                request.getRemoteAddr());
    }

    /** First value of each query parameter, decoded. Form bodies are never read. */
    static Map<String, String> queryParams(String query) {
        if (query == null || query.isBlank()) {
            return Map.of();
        }
        MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance().query(query).build().getQueryParams();
        Map<String, String> params = new LinkedHashMap<>();
        raw.forEach((name, values) -> params.put(decode(name), decode(first(values))));
        return params;
    }

    private static String first(List<String> values) {
        return values.isEmpty() || values.get(0) == null ? "" : values.get(0);
    }

    private static String decode(String value) {
        try {
            return UriUtils.decode(value.replace("+", "%20"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    static String processTime(long nanos) {
        return String.format(Locale.ROOT, "%.6f", nanos / 1_000_000_000.0);
    }
}
