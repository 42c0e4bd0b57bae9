package com.oapce.sentinel.model;

import java.time.LocalDate;

public record TimeSeriesPoint(LocalDate date, double value) {
    public TimeSeriesPoint {
        if (date == null) {
            throw new IllegalArgumentException("date must be provided");
        }
    }
}
