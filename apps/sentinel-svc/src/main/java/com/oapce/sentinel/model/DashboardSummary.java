package com.oapce.sentinel.model;

import java.util.List;
import java.util.Map;

public record DashboardSummary(
        Map<Severity, SeverityCounts> severityCounts,
        List<Alert> recent,
        long totalCount
) {
    public record SeverityCounts(long total, long open, long acknowledged, long resolved) {

        public static SeverityCounts empty() {
            return new SeverityCounts(0, 0, 0, 0);
        }

        public SeverityCounts plus(AlertStatus status, long count) {
            return new SeverityCounts(
                    total + count,
                    open + (status == AlertStatus.OPEN ? count : 0),
                    acknowledged + (status == AlertStatus.ACKNOWLEDGED ? count : 0),
                    resolved + (status == AlertStatus.RESOLVED ? count : 0)
            );
        }
    }
}
