package com.oapce.sentinel.controller.dto;

import java.time.Instant;
import java.time.LocalDate;

public record ModelRunResponseDto(
        long id,
        String modelName,
        LocalDate trainingDate,
        String parameters,
        Integer datasetSize,
        Instant createdAt
) {
}
