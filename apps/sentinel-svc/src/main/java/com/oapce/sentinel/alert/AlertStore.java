package com.oapce.sentinel.alert;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AnomalyCandidate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns aggregated candidates into alerts. Within the dedup window a metric has at most one
 * current alert: a more severe candidate escalates it in place, anything else is absorbed.
 *
 * <p>Submissions for the same metric are serialized through a fixed set of lock stripes, so that
 * two concurrent runs cannot both observe "no recent alert" and insert twice.
 */
@Component
public class AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    static final int LOCK_STRIPES = 64;

    private final AlertRepository repository;
    private final Duration dedupWindow;
    private final SentinelProperties.DedupAnchor anchor;
    private final int maxAttempts;
    private final Clock clock;
    private final ReentrantLock[] metricLocks = new ReentrantLock[LOCK_STRIPES];

    @Autowired
    public AlertStore(AlertRepository repository, SentinelProperties properties, Clock clock) {
        this(repository, properties.alerts(), clock);
    }

    AlertStore(AlertRepository repository, SentinelProperties.Alerts config, Clock clock) {
        this.repository = repository;
        this.dedupWindow = Duration.ofHours(config.dedupWindowHours());
        this.anchor = config.dedupAnchor();
        this.maxAttempts = config.submitRetries();
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            metricLocks[i] = new ReentrantLock();
        }
    }

    /**
     * @return the created or escalated alert, or empty when the candidate was absorbed by an
     *     existing alert of equal or higher severity
     */
    public Optional<Alert> submit(AnomalyCandidate candidate) {
        ReentrantLock lock = metricLocks[stripeFor(candidate.metricName())];
        lock.lock();
        try {
            for (int attempt = 1; ; attempt++) {
                try {
                    return submitLocked(candidate);
                } catch (ConcurrencyConflictException ex) {
                    if (attempt >= maxAttempts) {
                        throw ex;
                    }
                    log.warn("Alert store: conflict submitting {} candidate for {} (attempt {}/{}), retrying",
                            candidate.severity().wireName(), candidate.metricName(), attempt, maxAttempts);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lock stripe of a metric. Metrics sharing a stripe are serialized together.
     */
    static int stripeFor(String metricName) {
        return Math.floorMod(metricName.hashCode(), LOCK_STRIPES);
    }

    private Optional<Alert> submitLocked(AnomalyCandidate candidate) {
        Instant now = clock.instant();
        Optional<Alert> recent = findCurrent(candidate, now);
        if (recent.isEmpty()) {
            Alert created = repository.insert(Alert.open(candidate, now));
            log.info("Alert store: opened alert {} for {} on {} (severity={}, method={})", created.id(),
                    created.metricName(), candidate.timestamp(), created.severity().wireName(), created.detectionMethod());
            return Optional.of(created);
        }
        Alert existing = recent.get();
        if (!candidate.severity().isHigherThan(existing.severity())) {
            log.debug("Alert store: {} candidate for {} on {} absorbed by alert {} ({})",
                    candidate.severity().wireName(), candidate.metricName(), candidate.timestamp(),
                    existing.id(), existing.severity().wireName());
            return Optional.empty();
        }
        Optional<Alert> escalated = repository.update(existing.id(), current -> current.escalate(candidate, now));
        escalated.ifPresent(alert -> log.info("Alert store: escalated alert {} for {} from {} to {}",
                alert.id(), alert.metricName(), existing.severity().wireName(), alert.severity().wireName()));
        return escalated;
    }

    private Optional<Alert> findCurrent(AnomalyCandidate candidate, Instant now) {
        if (anchor == SentinelProperties.DedupAnchor.CANDIDATE_TIMESTAMP) {
            long windowDays = Math.max(1, dedupWindow.toDays());
            LocalDate day = candidate.timestamp();
            return repository.findLatestByMetricObservedBetween(candidate.metricName(),
                    day.minusDays(windowDays), day.plusDays(windowDays));
        }
        return repository.findLatestByMetricSince(candidate.metricName(), now.minus(dedupWindow));
    }
}
