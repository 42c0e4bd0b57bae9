package com.oapce.sentinel.model;

import java.util.List;

public record DetectionRunResult(
        boolean success,
        String metricName,
        int dataPoints,
        int anomaliesDetected,
        int anomaliesSaved,
        List<String> methodsUsed,
        List<DetectedAnomaly> anomalies,
        String reason
) {
    public static final String INSUFFICIENT_DATA = "insufficient data";

    public static DetectionRunResult insufficientData(String metricName, int distinctDays) {
        return new DetectionRunResult(false, metricName, distinctDays, 0, 0, List.of(), List.of(), INSUFFICIENT_DATA);
    }
}
