package com.oapce.sentinel.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeasonalResidualDetectorTest {

    private final SeasonalResidualDetector detector =
            new SeasonalResidualDetector(SentinelProperties.Seasonal.defaults(), true);

    @Test
    void unavailableWithoutRegressionLibrary() {
        SeasonalResidualDetector missing = new SeasonalResidualDetector(SentinelProperties.Seasonal.defaults(), false);

        DetectorOutcome outcome = missing.detect(SeriesFixtures.constant(35, 1000d), "sales_total");

        assertThat(missing.isAvailable()).isFalse();
        assertThat(outcome.status()).isEqualTo(DetectorOutcome.Status.UNAVAILABLE);
        assertThat(outcome.candidates()).isEmpty();
    }

    @Test
    void flagsSpikeAsCritical() {
        List<TimeSeriesPoint> series = SeriesFixtures.withSpike(35, 1000d, 19, 15_000d);

        DetectorOutcome outcome = detector.detect(series, "sales_total");

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.candidates())
                .hasSize(1)
                .first()
                .satisfies(candidate -> {
                    assertThat(candidate.timestamp()).isEqualTo(SeriesFixtures.START.plusDays(19));
                    assertThat(candidate.detectionMethod()).isEqualTo(DetectionMethod.SEASONAL_RESIDUAL);
                    assertThat(candidate.severity()).isEqualTo(Severity.CRITICAL);
                    assertThat(candidate.expectedRange().max()).isLessThan(15_000d);
                });
    }

    @Test
    void flatSeriesIsDegenerateAndYieldsNothing() {
        DetectorOutcome outcome = detector.detect(SeriesFixtures.constant(35, 1000d), "sales_total");

        assertThat(outcome.isCompleted()).isTrue();
        assertThat(outcome.candidates()).isEmpty();
    }

    @Test
    void weekdayTermsOnlyWithTwoWeeksOfData() {
        assertThat(detector.designMatrix(SeriesFixtures.constant(13, 1d))[0]).hasSize(1);
        assertThat(detector.designMatrix(SeriesFixtures.constant(14, 1d))[0]).hasSize(7);
        assertThat(detector.designMatrix(SeriesFixtures.constant(730, 1d))[0]).hasSize(13);
    }
}
