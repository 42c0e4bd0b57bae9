package com.oapce.sentinel.timeseries;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.DailyRecord;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns raw dated records into a contiguous daily series: one point per calendar day between the
 * first and last observed day, amounts summed per day and missing days filled with zero.
 */
@Component
public class TimeSeriesBuilder {

    private static final Logger log = LoggerFactory.getLogger(TimeSeriesBuilder.class);

    public static final int DEFAULT_MIN_DISTINCT_DAYS = 10;

    private final int minDistinctDays;

    @Autowired
    public TimeSeriesBuilder(SentinelProperties properties) {
        this(properties.detection().minDistinctDays());
    }

    public TimeSeriesBuilder(int minDistinctDays) {
        if (minDistinctDays <= 0) {
            throw new IllegalArgumentException("minDistinctDays must be positive");
        }
        this.minDistinctDays = minDistinctDays;
    }

    public List<TimeSeriesPoint> build(List<DailyRecord> records, int lookbackDays) {
        TreeMap<LocalDate, BigDecimal> byDay = new TreeMap<>();
        if (records != null) {
            for (DailyRecord record : records) {
                byDay.merge(record.date(), record.amount(), BigDecimal::add);
            }
        }
        if (byDay.size() < minDistinctDays) {
            throw new InsufficientDataException(byDay.size(), minDistinctDays);
        }
        LocalDate first = byDay.firstKey();
        LocalDate last = byDay.lastKey();
        List<TimeSeriesPoint> series = new ArrayList<>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            BigDecimal amount = byDay.getOrDefault(day, BigDecimal.ZERO);
            series.add(new TimeSeriesPoint(day, amount.doubleValue()));
        }
        log.debug("Time series built: {} distinct days -> {} points ({} to {}, lookback {} days)",
                byDay.size(), series.size(), first, last, lookbackDays);
        return List.copyOf(series);
    }

    public int minDistinctDays() {
        return minDistinctDays;
    }
}
