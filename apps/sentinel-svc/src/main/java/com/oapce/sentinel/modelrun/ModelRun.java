package com.oapce.sentinel.modelrun;

import java.time.Instant;
import java.time.LocalDate;

public record ModelRun(
        Long id,
        String modelName,
        LocalDate trainingDate,
        String parameters,
        Integer datasetSize,
        Double precision,
        Double recall,
        Double f1Score,
        Instant createdAt
) {
}
