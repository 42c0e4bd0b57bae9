package com.oapce.sentinel.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import org.junit.jupiter.api.Test;

class IsolationForestDetectorTest {

    private final IsolationForestDetector detector =
            new IsolationForestDetector(SentinelProperties.IsolationForest.defaults());

    @Test
    void flagsSingleSpikeInFlatSeries() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.withSpike(40, 100d, 20, 10_000d), "sales_total");

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.candidates())
                .hasSize(1)
                .first()
                .satisfies(candidate -> {
                    assertThat(candidate.timestamp()).isEqualTo(SeriesFixtures.START.plusDays(20));
                    assertThat(candidate.metricValue()).isEqualTo(10_000d);
                    assertThat(candidate.detectionMethod()).isEqualTo(DetectionMethod.ISOLATION_FOREST);
                    assertThat(candidate.severity()).isEqualTo(Severity.MEDIUM);
                    assertThat(candidate.expectedRange().min()).isEqualTo(100d);
                    assertThat(candidate.notes()).startsWith("Anomaly detected by isolation forest. Score: -");
                });
    }

    @Test
    void constantSeriesHasNoCandidates() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.constant(30, 42d), "sales_total");

        assertThat(outcome.candidates()).isEmpty();
    }

    @Test
    void parametersDescribeTheModel() {
        assertThat(detector.parameters())
                .containsEntry("contamination", 0.1d)
                .containsEntry("n_estimators", 100);
    }
}
