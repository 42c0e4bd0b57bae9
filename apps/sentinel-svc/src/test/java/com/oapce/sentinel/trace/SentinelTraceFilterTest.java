package com.oapce.sentinel.trace;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SentinelTraceFilterTest {

    private final SentinelTraceFilter filter = new SentinelTraceFilter();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void plainCallerTraceIdIsKept() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/anomalies/detect");
        request.addHeader(SentinelTraceFilter.TRACE_HEADER, "dash.run-7_a");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(SentinelTraceFilter.TRACE_HEADER)).isEqualTo("dash.run-7_a");
    }

    @Test
    void malformedOrOversizedTraceIdIsReplaced() {
        assertThat(SentinelTraceFilter.resolveTraceId("bad id\r\nX-Injected: 1")).hasSize(36);
        assertThat(SentinelTraceFilter.resolveTraceId("a".repeat(65))).hasSize(36);
        assertThat(SentinelTraceFilter.resolveTraceId("  ")).hasSize(36);
        assertThat(SentinelTraceFilter.resolveTraceId(null)).hasSize(36);
        assertThat(SentinelTraceFilter.resolveTraceId("a".repeat(64))).isEqualTo("a".repeat(64));
    }

    @Test
    void metricParameterIsVisibleDuringTheCallAndClearedAfter() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/anomalies/metrics/series");
        request.addParameter("metric", "sales_total");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenMetric = new AtomicReference<>();
        AtomicReference<String> seenTrace = new AtomicReference<>();
        AtomicReference<String> contextTrace = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> {
            seenMetric.set(MDC.get(RequestContextHolder.METRIC_MDC_KEY));
            seenTrace.set(MDC.get(RequestContextHolder.TRACE_MDC_KEY));
            contextTrace.set(RequestContextHolder.currentTraceId());
        });

        assertThat(seenMetric.get()).isEqualTo("sales_total");
        assertThat(seenTrace.get()).isEqualTo(response.getHeader(SentinelTraceFilter.TRACE_HEADER));
        assertThat(contextTrace.get()).isEqualTo(seenTrace.get());
        assertThat(MDC.get(RequestContextHolder.TRACE_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestContextHolder.METRIC_MDC_KEY)).isNull();
        assertThat(RequestContextHolder.get()).isEmpty();
    }

    @Test
    void nestedScopeRestoresOuterContext() {
        try (RequestContextHolder.Scope outer = RequestContextHolder.open("outer", "sales_total")) {
            try (RequestContextHolder.Scope inner = RequestContextHolder.open("inner", null)) {
                assertThat(RequestContextHolder.currentTraceId()).isEqualTo("inner");
                assertThat(MDC.get(RequestContextHolder.METRIC_MDC_KEY)).isNull();
            }
            assertThat(RequestContextHolder.currentTraceId()).isEqualTo("outer");
            assertThat(MDC.get(RequestContextHolder.METRIC_MDC_KEY)).isEqualTo("sales_total");
        }
        assertThat(RequestContextHolder.get()).isEmpty();
    }
}
