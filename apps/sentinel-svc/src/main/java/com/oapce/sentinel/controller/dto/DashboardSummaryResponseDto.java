package com.oapce.sentinel.controller.dto;

import java.util.List;
import java.util.Map;

public record DashboardSummaryResponseDto(
        Map<String, SeverityCountsDto> severitySummary,
        List<AlertResponseDto> recentAnomalies,
        long totalAnomalies,
        String traceId
) {
    public record SeverityCountsDto(long total, long open, long acknowledged, long resolved) {
    }
}
