package com.voucherpay.pipeline;

import com.voucherpay.eventmodel.AccessibilityFlags;
import com.voucherpay.eventmodel.AnalyticsEvent;
import com.voucherpay.eventmodel.AnalyticsSink;
import com.voucherpay.eventmodel.EmpowermentFeatureFlags;
import com.voucherpay.eventmodel.FeatureArea;
import com.voucherpay.eventmodel.ImpactIndicators;
import com.voucherpay.eventmodel.RequestInfo;
import com.voucherpay.eventmodel.ResponseInfo;
import com.voucherpay.eventmodel.SinkUnavailableException;
import com.voucherpay.observability.MetricFactory;
import com.voucherpay.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.Counter;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one {@link AnalyticsEvent} from the finished response and emits it.
 * <p>
 * Never changes the response. Sink failures are logged and counted as dropped events.
 */
public class AnalyticsDerivationStage implements ResponseStage {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsDerivationStage.class);

    static final Map<FeatureArea, List<String>> FEATURE_PATHS = featurePaths();
    static final List<String> OPPORTUNITY_PATHS = List.of("/jobs", "/funding", "/housing", "/grants");
    static final List<String> SUPPORT_PATHS = List.of("/assistance", "/support", "/help", "/ai", "/recommendations");

    private final AnalyticsSink sink;
    private final Clock clock;
    private final SensitiveDataRedactor redactor;
    private final Counter emitted;
    private final Counter unavailable;
    private final Counter failed;

    public AnalyticsDerivationStage(AnalyticsSink sink, Clock clock, SensitiveDataRedactor redactor, MetricFactory metrics) {
        this.sink = sink;
        this.clock = clock;
        this.redactor = redactor;
        this.emitted = metrics.counter("analytics.events.emitted", "Analytics events accepted by the sink");
        this.unavailable = metrics.counter("analytics.events.dropped", "Analytics events dropped", "reason", "sink_unavailable");
        this.failed = metrics.counter("analytics.events.dropped", "Analytics events dropped", "reason", "error");
    }

    @Override
    public PipelineResponse afterHandler(PipelineExchange exchange, PipelineResponse response) {
        AnalyticsEvent event;
        try {
            event = derive(exchange, response);
        } catch (RuntimeException e) {
            failed.increment();
            log.error("Failed to derive analytics event for {} {}", exchange.request().method(), exchange.request().path(), e);
            return response;
        }
        try {
            sink.emit(event);
            emitted.increment();
        } catch (SinkUnavailableException e) {
            unavailable.increment();
            log.warn("Analytics sink unavailable, dropping event {}: {}", event.eventId(), e.getMessage());
        } catch (RuntimeException e) {
            failed.increment();
            log.error("Failed to log analytics event {}", event.eventId(), e);
        }
        return response;
    }

    /** Builds the event for a finished exchange without emitting it. */
    public AnalyticsEvent derive(PipelineExchange exchange, PipelineResponse response) {
        PipelineRequest request = exchange.request();
        AccessibilityFlags accessibility = exchange.accessibilityContext().flags();
        EmpowermentFeatureFlags empowerment = classify(request.path());
        ResponseInfo responseInfo = ResponseInfo.of(response.status(), Duration.ofNanos(exchange.elapsedNanos()));

        RequestInfo requestInfo = new RequestInfo(
                request.method(),
                redactor.redactUrl(request.url()),
                request.path(),
                redactor.redact(request.queryParams()),
                exchange.accessibilityContext().userAgent(),
                request.remoteAddress(),
                exchange.receivedAt());

        return AnalyticsEvent.apiRequest(
                clock.instant(),
                requestInfo,
                responseInfo,
                accessibility,
                empowerment,
                impact(accessibility, empowerment, request.path(), responseInfo.success()),
                exchange.userId().orElse(null),
                exchange.sessionId().orElse(null),
                exchange.correlationId().orElse(null));
    }

    /** Feature areas whose path fragments occur in {@code path}. */
    public static EmpowermentFeatureFlags classify(String path) {
        var touched = new ArrayList<FeatureArea>();
        FEATURE_PATHS.forEach((area, fragments) -> {
            if (containsAny(path, fragments)) {
                touched.add(area);
            }
        });
        return EmpowermentFeatureFlags.of(touched);
    }

    public static ImpactIndicators impact(
            AccessibilityFlags accessibility, EmpowermentFeatureFlags empowerment, String path, boolean success) {
        if (!success) {
            return ImpactIndicators.NONE;
        }
        return new ImpactIndicators(
                accessibility.anyEnabled() && empowerment.anyTouched(),
                containsAny(path, OPPORTUNITY_PATHS),
                containsAny(path, SUPPORT_PATHS));
    }

    private static boolean containsAny(String path, List<String> fragments) {
        for (String fragment : fragments) {
            if (path.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static Map<FeatureArea, List<String>> featurePaths() {
        Map<FeatureArea, List<String>> paths = new EnumMap<>(FeatureArea.class);
        paths.put(FeatureArea.SOCIAL_SECURITY, List.of("/social-security", "/benefits", "/assistance"));
        paths.put(FeatureArea.HOUSING, List.of("/housing", "/accommodation", "/accessibility-housing"));
        paths.put(FeatureArea.BUSINESS_FUNDING, List.of("/funding", "/grants", "/business-support"));
        paths.put(FeatureArea.JOBS, List.of("/jobs", "/employment", "/careers"));
        paths.put(FeatureArea.NON_DISCRIMINATION, List.of("/report", "/discrimination", "/advocacy"));
        paths.put(FeatureArea.ACCESSIBILITY, List.of("/accessibility", "/wcag", "/assistive"));
        paths.put(FeatureArea.AI_ASSISTANCE, List.of("/ai", "/assistance", "/recommendations"));
        return paths;
    }
}
