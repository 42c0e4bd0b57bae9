package com.oapce.sentinel.detection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DetectionEnsembleTest {

    private final ModelRunRecorder recorder = mock(ModelRunRecorder.class);
    private DetectionEnsemble ensemble;

    @AfterEach
    void tearDown() {
        if (ensemble != null) {
            ensemble.shutdown();
        }
    }

    @Test
    void skipsUnavailableDetectorAndRecordsCompletedRuns() {
        List<TimeSeriesPoint> series = SeriesFixtures.constant(12, 5d);
        AnomalyCandidate candidate = new AnomalyCandidate(series.get(3).date(), "sales_total", 5d, null,
                Severity.MEDIUM, DetectionMethod.ROLLING_ZSCORE, 3.5d, "z");
        Detector rolling = detector(DetectionMethod.ROLLING_ZSCORE, true);
        Detector seasonal = detector(DetectionMethod.SEASONAL_RESIDUAL, false);
        when(rolling.detect(anyList(), eq("sales_total")))
                .thenReturn(DetectorOutcome.completed(DetectionMethod.ROLLING_ZSCORE, List.of(candidate)));

        ensemble = new DetectionEnsemble(List.of(rolling, seasonal), 1, recorder);
        EnsembleRun run = ensemble.run(series, "sales_total");

        assertThat(ensemble.methods()).containsExactly(DetectionMethod.ROLLING_ZSCORE);
        assertThat(ensemble.unavailableMethods()).containsExactly(DetectionMethod.SEASONAL_RESIDUAL);
        assertThat(run.methodsUsed()).containsExactly(DetectionMethod.ROLLING_ZSCORE);
        assertThat(run.candidates()).containsExactly(candidate);
        verify(seasonal, never()).detect(anyList(), anyString());
        verify(recorder).recordRun(eq("rolling_zscore"), eq(Map.<String, Object>of("window_size", 30)), eq(12));
    }

    @Test
    void failingDetectorDoesNotStopTheOthers() {
        Detector forest = detector(DetectionMethod.ISOLATION_FOREST, true);
        Detector rolling = detector(DetectionMethod.ROLLING_ZSCORE, true);
        when(forest.detect(anyList(), anyString())).thenThrow(new IllegalStateException("boom"));
        when(rolling.detect(anyList(), anyString()))
                .thenReturn(DetectorOutcome.completed(DetectionMethod.ROLLING_ZSCORE, List.of()));

        ensemble = new DetectionEnsemble(List.of(rolling, forest), 2, recorder);
        EnsembleRun run = ensemble.run(SeriesFixtures.constant(12, 5d), "sales_total");

        assertThat(run.outcomes()).extracting(DetectorOutcome::method)
                .containsExactly(DetectionMethod.ISOLATION_FOREST, DetectionMethod.ROLLING_ZSCORE);
        assertThat(run.outcomes().get(0).status()).isEqualTo(DetectorOutcome.Status.FAILED);
        assertThat(run.methodsUsed()).containsExactly(DetectionMethod.ROLLING_ZSCORE);
        verify(recorder, never()).recordRun(eq("isolation_forest"), any(), anyInt());
    }

    private static Detector detector(DetectionMethod method, boolean available) {
        Detector detector = mock(Detector.class);
        when(detector.method()).thenReturn(method);
        when(detector.isAvailable()).thenReturn(available);
        when(detector.parameters()).thenReturn(Map.<String, Object>of("window_size", 30));
        return detector;
    }
}
