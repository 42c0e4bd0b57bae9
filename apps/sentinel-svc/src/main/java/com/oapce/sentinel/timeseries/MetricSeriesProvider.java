package com.oapce.sentinel.timeseries;

import com.oapce.sentinel.model.DailyRecord;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of raw daily records for a named metric. Records may be sparse, unsorted and contain
 * several entries for the same day; {@link TimeSeriesBuilder} normalizes them.
 */
public interface MetricSeriesProvider {

    /**
     * @param lookbackDays number of calendar days to return, today included
     */
    List<DailyRecord> getDailySeries(String metricName, int lookbackDays);

    /**
     * First day of a lookback window of {@code lookbackDays} days ending today.
     */
    static LocalDate windowStart(Clock clock, int lookbackDays) {
        return LocalDate.now(clock).minusDays(Math.max(1, lookbackDays) - 1L);
    }
}
