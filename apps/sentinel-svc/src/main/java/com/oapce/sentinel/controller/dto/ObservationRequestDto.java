package com.oapce.sentinel.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;

public record ObservationRequestDto(
        @NotBlank @Size(max = 100) String metricName,
        @NotNull LocalDate date,
        @NotNull BigDecimal amount
) {
}
