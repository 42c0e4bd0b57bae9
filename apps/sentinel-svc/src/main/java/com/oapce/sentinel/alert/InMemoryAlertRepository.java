package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.Severity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAlertRepository implements AlertRepository {

    private static final Comparator<Alert> NEWEST_FIRST = Comparator
            .comparing(Alert::timestamp)
            .thenComparing(Alert::id)
            .reversed();

    private final Map<Long, Alert> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Alert insert(Alert alert) {
        if (alert.id() != null) {
            throw new IllegalArgumentException("new alert must not carry an id");
        }
        Alert stored = alert.withId(sequence.incrementAndGet());
        storage.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Alert> update(long alertId, UnaryOperator<Alert> mutation) {
        return Optional.ofNullable(storage.computeIfPresent(alertId, (id, current) -> mutation.apply(current).withId(id)));
    }

    @Override
    public Optional<Alert> findById(long alertId) {
        return Optional.ofNullable(storage.get(alertId));
    }

    @Override
    public Optional<Alert> findLatestByMetricSince(String metricName, Instant since) {
        return byMetric(metricName)
                .filter(alert -> !alert.timestamp().isBefore(since))
                .min(NEWEST_FIRST);
    }

    @Override
    public Optional<Alert> findLatestByMetricObservedBetween(String metricName, LocalDate from, LocalDate to) {
        return byMetric(metricName)
                .filter(alert -> alert.observedOn() != null)
                .filter(alert -> !alert.observedOn().isBefore(from) && !alert.observedOn().isAfter(to))
                .min(NEWEST_FIRST);
    }

    @Override
    public List<Alert> search(Optional<String> metricName, Optional<AlertStatus> status, Instant since, int limit) {
        Stream<Alert> matches = storage.values().stream()
                .filter(alert -> metricName.map(alert.metricName()::equals).orElse(true))
                .filter(alert -> status.map(s -> s == alert.status()).orElse(true))
                .filter(alert -> !alert.timestamp().isBefore(since))
                .sorted(NEWEST_FIRST);
        if (limit > 0) {
            matches = matches.limit(limit);
        }
        return matches.collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<SeverityStatusCount> countBySeverityAndStatus() {
        Map<Key, Long> counts = storage.values().stream()
                .collect(Collectors.groupingBy(alert -> new Key(alert.severity(), alert.status()), Collectors.counting()));
        return counts.entrySet().stream()
                .map(entry -> new SeverityStatusCount(entry.getKey().severity(), entry.getKey().status(), entry.getValue()))
                .toList();
    }

    private record Key(Severity severity, AlertStatus status) {}

    private Stream<Alert> byMetric(String metricName) {
        return storage.values().stream().filter(alert -> alert.metricName().equals(metricName));
    }
}
