package com.oapce.sentinel.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Gives every API call a trace id, echoed in the response header and in error bodies. A caller
 * supplied id is reused when it is a plain token, so a dashboard can correlate its own requests;
 * anything else is replaced. The {@code metric} request parameter, when present, is added to the
 * logging context.
 */
@Component
public class SentinelTraceFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Sentinel-Trace";
    static final String METRIC_PARAM = "metric";

    private static final Pattern ACCEPTED_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        response.setHeader(TRACE_HEADER, traceId);
        try (RequestContextHolder.Scope ignored = RequestContextHolder.open(traceId, request.getParameter(METRIC_PARAM))) {
            filterChain.doFilter(request, response);
        }
    }

    static String resolveTraceId(String supplied) {
        if (supplied != null && ACCEPTED_TRACE_ID.matcher(supplied).matches()) {
            return supplied;
        }
        return UUID.randomUUID().toString();
    }
}
