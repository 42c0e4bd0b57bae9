package com.oapce.sentinel.controller.dto;

import com.oapce.sentinel.trace.RequestContextHolder;
import java.util.Map;

/**
 * Error body of the anomaly API. {@code traceId} matches the {@code X-Sentinel-Trace} response
 * header of the failed call.
 */
public record ErrorResponseDto(String code, String message, Map<String, Object> details, String traceId) {

    public ErrorResponseDto {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static ErrorResponseDto of(String code, String message, Map<String, Object> details) {
        return new ErrorResponseDto(code, message, details, RequestContextHolder.currentTraceId());
    }
}
