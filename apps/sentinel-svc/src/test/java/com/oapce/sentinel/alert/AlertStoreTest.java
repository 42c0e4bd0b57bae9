package com.oapce.sentinel.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AlertStoreTest {

    private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 5, 30);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final InMemoryAlertRepository repository = new InMemoryAlertRepository();

    @Test
    void higherSeverityEscalatesExistingAlertInPlace() {
        AlertStore store = store(SentinelProperties.Alerts.defaults());

        Alert opened = store.submit(candidate(DAY, Severity.MEDIUM, 1200d)).orElseThrow();
        Alert escalated = store.submit(candidate(DAY, Severity.HIGH, 1500d)).orElseThrow();

        assertThat(escalated.id()).isEqualTo(opened.id());
        assertThat(escalated.severity()).isEqualTo(Severity.HIGH);
        assertThat(escalated.metricValue()).isEqualTo(1200d);
        assertThat(escalated.notes()).isEqualTo("HIGH candidate");
        assertThat(escalated.status()).isEqualTo(AlertStatus.OPEN);
        assertThat(allAlerts()).hasSize(1);
    }

    @Test
    void lowerOrEqualSeverityIsAbsorbed() {
        AlertStore store = store(SentinelProperties.Alerts.defaults());
        store.submit(candidate(DAY, Severity.HIGH, 1500d));

        assertThat(store.submit(candidate(DAY, Severity.LOW, 900d))).isEmpty();
        assertThat(store.submit(candidate(DAY, Severity.HIGH, 1600d))).isEmpty();
        assertThat(allAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.severity()).isEqualTo(Severity.HIGH));
    }

    @Test
    void alertsOutsideSubmissionWindowDoNotDeduplicate() {
        Alert stale = repository.insert(Alert.open(candidate(DAY, Severity.CRITICAL, 5000d), NOW.minus(Duration.ofHours(25))));
        AlertStore store = store(SentinelProperties.Alerts.defaults());

        Optional<Alert> created = store.submit(candidate(DAY, Severity.LOW, 900d));

        assertThat(created).isPresent();
        assertThat(created.get().id()).isNotEqualTo(stale.id());
        assertThat(allAlerts()).hasSize(2);
    }

    @Test
    void candidateTimestampAnchorSeparatesDistantDays() {
        AlertStore store = store(new SentinelProperties.Alerts(24, SentinelProperties.DedupAnchor.CANDIDATE_TIMESTAMP, 3));

        store.submit(candidate(DAY.minusDays(10), Severity.MEDIUM, 1200d));
        Optional<Alert> sameDay = store.submit(candidate(DAY.minusDays(10), Severity.LOW, 1100d));
        Optional<Alert> laterDay = store.submit(candidate(DAY, Severity.LOW, 900d));

        assertThat(sameDay).isEmpty();
        assertThat(laterDay).isPresent();
        assertThat(allAlerts()).hasSize(2);
    }

    @Test
    void retriesOnConcurrencyConflict() {
        AlertRepository conflicting = mock(AlertRepository.class);
        when(conflicting.findLatestByMetricSince(anyString(), any(Instant.class))).thenReturn(Optional.empty());
        when(conflicting.insert(any(Alert.class)))
                .thenThrow(new ConcurrencyConflictException("alert changed concurrently", null))
                .thenAnswer(invocation -> invocation.<Alert>getArgument(0).withId(7L));
        AlertStore store = new AlertStore(conflicting, SentinelProperties.Alerts.defaults(), clock);

        Optional<Alert> created = store.submit(candidate(DAY, Severity.MEDIUM, 1200d));

        assertThat(created).map(Alert::id).contains(7L);
        verify(conflicting, times(2)).insert(any(Alert.class));
    }

    @Test
    void givesUpAfterRetryBudget() {
        AlertRepository conflicting = mock(AlertRepository.class);
        when(conflicting.findLatestByMetricSince(anyString(), any(Instant.class))).thenReturn(Optional.empty());
        when(conflicting.insert(any(Alert.class)))
                .thenThrow(new ConcurrencyConflictException("alert changed concurrently", null));
        AlertStore store = new AlertStore(conflicting, new SentinelProperties.Alerts(24, null, 2), clock);

        assertThatThrownBy(() -> store.submit(candidate(DAY, Severity.MEDIUM, 1200d)))
                .isInstanceOf(ConcurrencyConflictException.class);
        verify(conflicting, times(2)).insert(any(Alert.class));
    }

    @Test
    void concurrentSubmissionsForOneMetricLeaveSingleMostSevereAlert() throws Exception {
        AlertStore store = store(SentinelProperties.Alerts.defaults());
        Severity[] severities = Severity.values();
        int submissions = 200;
        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Alert>>> results = new ArrayList<>();
        try {
            for (int i = 0; i < submissions; i++) {
                Severity severity = severities[i % severities.length];
                double value = 1000d + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return store.submit(candidate(DAY, severity, value));
                }));
            }
            start.countDown();
            for (Future<Optional<Alert>> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(allAlerts()).singleElement()
                .satisfies(alert -> assertThat(alert.severity()).isEqualTo(Severity.CRITICAL));
    }

    @Test
    void metricsMapToBoundedLockStripes() {
        for (String metric : List.of("sales_total", "collections_total", "", "a-much-longer-metric-name-for-hashing")) {
            assertThat(AlertStore.stripeFor(metric))
                    .isBetween(0, AlertStore.LOCK_STRIPES - 1)
                    .isEqualTo(AlertStore.stripeFor(new String(metric)));
        }
    }

    @Test
    void metricsSharingAStripeKeepSeparateAlerts() {
        AlertStore store = store(SentinelProperties.Alerts.defaults());
        // "Aa" and "BB" share a hash code, so they land on the same stripe
        assertThat(AlertStore.stripeFor("Aa")).isEqualTo(AlertStore.stripeFor("BB"));

        Optional<Alert> first = store.submit(new AnomalyCandidate(DAY, "Aa", 1d, null, Severity.LOW,
                DetectionMethod.ROLLING_ZSCORE, 3.1d, "first"));
        Optional<Alert> second = store.submit(new AnomalyCandidate(DAY, "BB", 1d, null, Severity.LOW,
                DetectionMethod.ROLLING_ZSCORE, 3.1d, "second"));

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(allAlerts()).hasSize(2);
    }

    private AlertStore store(SentinelProperties.Alerts config) {
        return new AlertStore(repository, config, clock);
    }

    private List<Alert> allAlerts() {
        return repository.search(Optional.empty(), Optional.empty(), Instant.EPOCH, 0);
    }

    private static AnomalyCandidate candidate(LocalDate day, Severity severity, double value) {
        return new AnomalyCandidate(day, "sales_total", value, new AnomalyCandidate.ExpectedRange(800d, 1100d),
                severity, DetectionMethod.ISOLATION_FOREST, 0.4d, severity.name() + " candidate");
    }
}
