package com.oapce.sentinel.trace;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Trace context of the current detection request or scheduled run. Opening a scope binds the
 * trace id, and the metric when one is known, to the thread and to the logging MDC.
 */
public final class RequestContextHolder {

    public static final String TRACE_MDC_KEY = "trace_id";
    public static final String METRIC_MDC_KEY = "metric";

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static Scope open(String traceId, String metricName) {
        RequestContext previous = CONTEXT.get();
        RequestContext context = new RequestContext(traceId, metricName);
        CONTEXT.set(context);
        MDC.put(TRACE_MDC_KEY, traceId);
        if (metricName != null && !metricName.isBlank()) {
            MDC.put(METRIC_MDC_KEY, metricName);
        } else {
            MDC.remove(METRIC_MDC_KEY);
        }
        return new Scope(previous);
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static String currentTraceId() {
        return get().map(RequestContext::traceId).orElse(null);
    }

    public record RequestContext(String traceId, String metricName) {
    }

    /**
     * Restores whatever context was bound before {@link #open}.
     */
    public static final class Scope implements AutoCloseable {

        private final RequestContext previous;

        private Scope(RequestContext previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                CONTEXT.remove();
                MDC.remove(TRACE_MDC_KEY);
                MDC.remove(METRIC_MDC_KEY);
                return;
            }
            CONTEXT.set(previous);
            MDC.put(TRACE_MDC_KEY, previous.traceId());
            if (previous.metricName() != null) {
                MDC.put(METRIC_MDC_KEY, previous.metricName());
            } else {
                MDC.remove(METRIC_MDC_KEY);
            }
        }
    }
}
