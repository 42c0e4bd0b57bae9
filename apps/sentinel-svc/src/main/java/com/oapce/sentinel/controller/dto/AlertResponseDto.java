package com.oapce.sentinel.controller.dto;

import com.oapce.sentinel.model.Alert;
import java.time.Instant;
import java.time.LocalDate;

public record AlertResponseDto(
        long id,
        String metricName,
        double metricValue,
        Double expectedRangeMin,
        Double expectedRangeMax,
        String severity,
        String status,
        String detectionMethod,
        String assignedTo,
        String notes,
        LocalDate observedOn,
        Instant timestamp,
        Instant createdAt,
        Instant updatedAt
) {
    public static AlertResponseDto from(Alert alert) {
        return new AlertResponseDto(
                alert.id(),
                alert.metricName(),
                alert.metricValue(),
                alert.expectedRangeMin(),
                alert.expectedRangeMax(),
                alert.severity().wireName(),
                alert.status().wireName(),
                alert.detectionMethod(),
                alert.assignedTo(),
                alert.notes(),
                alert.observedOn(),
                alert.timestamp(),
                alert.createdAt(),
                alert.updatedAt()
        );
    }
}
