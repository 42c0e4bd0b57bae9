package com.oapce.sentinel.model;

import java.time.LocalDate;

/**
 * An aggregated candidate that produced or escalated an alert, with that alert's id and status.
 */
public record DetectedAnomaly(
        long alertId,
        LocalDate timestamp,
        String metricName,
        double metricValue,
        Double expectedRangeMin,
        Double expectedRangeMax,
        Severity severity,
        DetectionMethod detectionMethod,
        double confidence,
        String notes,
        AlertStatus status
) {
    public static DetectedAnomaly of(AnomalyCandidate candidate, Alert alert) {
        return new DetectedAnomaly(
                alert.id(),
                candidate.timestamp(),
                candidate.metricName(),
                candidate.metricValue(),
                candidate.expectedRange() == null ? null : candidate.expectedRange().min(),
                candidate.expectedRange() == null ? null : candidate.expectedRange().max(),
                candidate.severity(),
                candidate.detectionMethod(),
                candidate.confidence(),
                candidate.notes(),
                alert.status()
        );
    }
}
