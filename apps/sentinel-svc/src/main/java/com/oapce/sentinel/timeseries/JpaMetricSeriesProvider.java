package com.oapce.sentinel.timeseries;

import com.oapce.sentinel.model.DailyRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class JpaMetricSeriesProvider implements MetricSeriesProvider {

    private final JpaMetricObservationRepository observationRepository;
    private final Clock clock;

    public JpaMetricSeriesProvider(JpaMetricObservationRepository observationRepository, Clock clock) {
        this.observationRepository = observationRepository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailyRecord> getDailySeries(String metricName, int lookbackDays) {
        LocalDate from = MetricSeriesProvider.windowStart(clock, lookbackDays);
        return observationRepository.findByMetricSince(metricName, from).stream()
                .map(entity -> new DailyRecord(entity.getObservedOn(), entity.getAmount()))
                .toList();
    }

    @Transactional
    public DailyRecord record(String metricName, LocalDate observedOn, BigDecimal amount) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
        if (observedOn == null) {
            throw new IllegalArgumentException("observedOn must be provided");
        }
        if (amount == null) {
            throw new IllegalArgumentException("amount must be provided");
        }
        MetricObservationEntity saved = observationRepository.save(
                new MetricObservationEntity(metricName.trim(), observedOn, amount, clock.instant()));
        return new DailyRecord(saved.getObservedOn(), saved.getAmount());
    }

    @Transactional(readOnly = true)
    public List<String> metricNames() {
        return observationRepository.findMetricNames();
    }
}
