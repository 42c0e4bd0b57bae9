package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.Severity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface AlertRepository {

    record SeverityStatusCount(Severity severity, AlertStatus status, long count) {}

    /**
     * Persists a new alert and returns it with its assigned id.
     */
    Alert insert(Alert alert);

    /**
     * Applies {@code mutation} to the stored alert as one atomic read-modify-write.
     *
     * @return the updated alert, or empty when no alert has that id
     * @throws ConcurrencyConflictException when another writer won the race
     */
    Optional<Alert> update(long alertId, UnaryOperator<Alert> mutation);

    Optional<Alert> findById(long alertId);

    /**
     * Most recent alert of the metric whose timestamp is at or after {@code since}.
     */
    Optional<Alert> findLatestByMetricSince(String metricName, Instant since);

    /**
     * Most recent alert of the metric observed on a day within {@code [from, to]}.
     */
    Optional<Alert> findLatestByMetricObservedBetween(String metricName, LocalDate from, LocalDate to);

    /**
     * Alerts at or after {@code since}, newest first. A non-positive limit returns all matches.
     */
    List<Alert> search(Optional<String> metricName, Optional<AlertStatus> status, Instant since, int limit);

    List<SeverityStatusCount> countBySeverityAndStatus();
}
