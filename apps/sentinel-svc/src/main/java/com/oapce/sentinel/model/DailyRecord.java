package com.oapce.sentinel.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Raw dated amount as returned by a {@link com.oapce.sentinel.timeseries.MetricSeriesProvider}.
 * Several records may share a day.
 */
public record DailyRecord(LocalDate date, BigDecimal amount) {
    public DailyRecord {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
        if (amount == null) {
            amount = BigDecimal.ZERO;
        }
    }
}
