package com.oapce.sentinel.controller.dto;

import java.util.List;

public record AlertsListResponseDto(List<AlertResponseDto> anomalies, int count, String traceId) {
}
