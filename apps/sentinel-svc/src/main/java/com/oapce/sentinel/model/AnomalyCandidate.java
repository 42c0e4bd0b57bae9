package com.oapce.sentinel.model;

import java.time.LocalDate;

/**
 * Unconfirmed anomaly emitted by a single detector before aggregation.
 */
public record AnomalyCandidate(
        LocalDate timestamp,
        String metricName,
        double metricValue,
        ExpectedRange expectedRange,
        Severity severity,
        DetectionMethod detectionMethod,
        double confidence,
        String notes
) {
    public AnomalyCandidate {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must be provided");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must be provided");
        }
        if (detectionMethod == null) {
            throw new IllegalArgumentException("detectionMethod must be provided");
        }
        if (confidence < 0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence must be non-negative");
        }
        if (notes == null) {
            notes = "";
        }
    }

    public record ExpectedRange(double min, double max) {
    }
}
