package com.oapce.sentinel.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ResolveRequestDto(@NotBlank @Size(max = 2000) String resolution) {
}
