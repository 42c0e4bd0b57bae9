package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.DashboardSummary;
import com.oapce.sentinel.model.Severity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Status transitions and read models over stored alerts.
 *
 * <p>Status only moves forward ({@code open -> acknowledged -> resolved}, or straight to
 * resolved). Acknowledging a resolved alert is accepted: it records the note and leaves the
 * status untouched.
 */
@Service
public class AlertLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleService.class);

    static final int RECENT_LIMIT = 10;

    private final AlertRepository repository;
    private final Clock clock;

    public AlertLifecycleService(AlertRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public Alert acknowledge(long alertId, Optional<String> assignedTo, Optional<String> note) {
        Instant now = clock.instant();
        String line = note.filter(text -> !text.isBlank())
                .map(text -> "Acknowledged: " + text.strip())
                .orElse("Acknowledged");
        Alert updated = repository.update(alertId, current -> {
            Alert next = current.withStatus(current.status().acknowledge(), now);
            if (assignedTo.isPresent() && !assignedTo.get().isBlank()) {
                next = next.withAssignedTo(assignedTo.get().strip());
            }
            return next.appendNote(logLine(now, line));
        }).orElseThrow(() -> new AlertNotFoundException(alertId));
        log.info("Alert lifecycle: alert {} acknowledged (status={}, assignedTo={})",
                alertId, updated.status().wireName(), updated.assignedTo());
        return updated;
    }

    public Alert resolve(long alertId, String resolution) {
        Instant now = clock.instant();
        String text = resolution == null || resolution.isBlank() ? "Resolved" : "Resolved: " + resolution.strip();
        Alert updated = repository.update(alertId, current ->
                current.withStatus(AlertStatus.RESOLVED, now).appendNote(logLine(now, text)))
                .orElseThrow(() -> new AlertNotFoundException(alertId));
        log.info("Alert lifecycle: alert {} resolved", alertId);
        return updated;
    }

    public Alert get(long alertId) {
        return repository.findById(alertId).orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    public List<Alert> query(Optional<String> metricName, Optional<AlertStatus> status, int sinceDays) {
        if (sinceDays < 0) {
            throw new IllegalArgumentException("sinceDays must not be negative");
        }
        Instant since = clock.instant().minus(Duration.ofDays(sinceDays));
        return repository.search(metricName.filter(name -> !name.isBlank()), status, since, 0);
    }

    public DashboardSummary dashboardSummary(int recentDays) {
        if (recentDays < 0) {
            throw new IllegalArgumentException("recentDays must not be negative");
        }
        Map<Severity, DashboardSummary.SeverityCounts> bySeverity = new EnumMap<>(Severity.class);
        long total = 0;
        for (AlertRepository.SeverityStatusCount row : repository.countBySeverityAndStatus()) {
            bySeverity.merge(row.severity(),
                    DashboardSummary.SeverityCounts.empty().plus(row.status(), row.count()),
                    (a, b) -> a.plus(row.status(), row.count()));
            total += row.count();
        }
        Instant since = clock.instant().minus(Duration.ofDays(recentDays));
        List<Alert> recent = repository.search(Optional.empty(), Optional.empty(), since, RECENT_LIMIT);
        return new DashboardSummary(new LinkedHashMap<>(bySeverity), recent, total);
    }

    private static String logLine(Instant at, String text) {
        return "[" + at + "] " + text;
    }
}
