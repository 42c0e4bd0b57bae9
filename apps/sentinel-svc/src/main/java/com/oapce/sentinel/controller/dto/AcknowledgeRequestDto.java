package com.oapce.sentinel.controller.dto;

import jakarta.validation.constraints.Size;

public record AcknowledgeRequestDto(
        @Size(max = 100) String assignedTo,
        @Size(max = 2000) String notes
) {
}
