package com.oapce.sentinel.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.oapce.sentinel.model.DetectedAnomaly;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DetectionRunResponseDto(
        boolean success,
        String metricName,
        int dataPoints,
        int anomaliesDetected,
        int anomaliesSaved,
        List<String> methodsUsed,
        List<DetectedAnomaly> anomalies,
        String reason,
        String traceId
) {
}
