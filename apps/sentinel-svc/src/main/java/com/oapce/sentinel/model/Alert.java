package com.oapce.sentinel.model;

import java.time.Instant;
import java.time.LocalDate;

public record Alert(
        Long id,
        String metricName,
        double metricValue,
        Double expectedRangeMin,
        Double expectedRangeMax,
        Severity severity,
        AlertStatus status,
        String detectionMethod,
        String assignedTo,
        String notes,
        LocalDate observedOn,
        Instant timestamp,
        Instant createdAt,
        Instant updatedAt
) {
    public static Alert open(AnomalyCandidate candidate, Instant now) {
        return new Alert(
                null,
                candidate.metricName(),
                candidate.metricValue(),
                rangeMin(candidate),
                rangeMax(candidate),
                candidate.severity(),
                AlertStatus.OPEN,
                candidate.detectionMethod().wireName(),
                null,
                candidate.notes(),
                candidate.timestamp(),
                now,
                now,
                now
        );
    }

    /**
     * Escalated copy carrying the stronger candidate's severity and notes. Identity, observation,
     * status and assignment are preserved.
     */
    public Alert escalate(AnomalyCandidate candidate, Instant now) {
        return new Alert(id, metricName, metricValue, expectedRangeMin, expectedRangeMax, candidate.severity(), status,
                detectionMethod, assignedTo, candidate.notes(), observedOn, now, createdAt, now);
    }

    public Alert withStatus(AlertStatus newStatus, Instant now) {
        return new Alert(id, metricName, metricValue, expectedRangeMin, expectedRangeMax, severity, newStatus,
                detectionMethod, assignedTo, notes, observedOn, timestamp, createdAt, now);
    }

    public Alert withAssignedTo(String newAssignee) {
        return new Alert(id, metricName, metricValue, expectedRangeMin, expectedRangeMax, severity, status,
                detectionMethod, newAssignee, notes, observedOn, timestamp, createdAt, updatedAt);
    }

    public Alert appendNote(String line) {
        String existing = notes == null ? "" : notes;
        String appended = (existing + "\n" + line).strip();
        return new Alert(id, metricName, metricValue, expectedRangeMin, expectedRangeMax, severity, status,
                detectionMethod, assignedTo, appended, observedOn, timestamp, createdAt, updatedAt);
    }

    public Alert withId(Long newId) {
        return new Alert(newId, metricName, metricValue, expectedRangeMin, expectedRangeMax, severity, status,
                detectionMethod, assignedTo, notes, observedOn, timestamp, createdAt, updatedAt);
    }

    private static Double rangeMin(AnomalyCandidate candidate) {
        return candidate.expectedRange() == null ? null : candidate.expectedRange().min();
    }

    private static Double rangeMax(AnomalyCandidate candidate) {
        return candidate.expectedRange() == null ? null : candidate.expectedRange().max();
    }
}
