package com.oapce.sentinel.timeseries;

import com.oapce.sentinel.model.DailyRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryMetricSeriesProvider implements MetricSeriesProvider {

    private final Map<String, List<DailyRecord>> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryMetricSeriesProvider(Clock clock) {
        this.clock = clock;
    }

    public void add(String metricName, LocalDate date, BigDecimal amount) {
        storage.computeIfAbsent(metricName, key -> new CopyOnWriteArrayList<>()).add(new DailyRecord(date, amount));
    }

    public void add(String metricName, LocalDate date, double amount) {
        add(metricName, date, BigDecimal.valueOf(amount));
    }

    @Override
    public List<DailyRecord> getDailySeries(String metricName, int lookbackDays) {
        LocalDate from = MetricSeriesProvider.windowStart(clock, lookbackDays);
        List<DailyRecord> result = new ArrayList<>();
        for (DailyRecord record : storage.getOrDefault(metricName, List.of())) {
            if (!record.date().isBefore(from)) {
                result.add(record);
            }
        }
        return result;
    }
}
