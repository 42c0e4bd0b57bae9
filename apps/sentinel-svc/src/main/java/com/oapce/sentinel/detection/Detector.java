package com.oapce.sentinel.detection;

import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.util.List;
import java.util.Map;

/**
 * Scans a contiguous daily series for outliers. Implementations are stateless and may be
 * invoked concurrently over the same series.
 */
public interface Detector {

    DetectionMethod method();

    /**
     * Whether the detector can run in this deployment. Queried once when the ensemble is built.
     */
    boolean isAvailable();

    DetectorOutcome detect(List<TimeSeriesPoint> series, String metricName);

    /**
     * Model parameters recorded alongside each completed run.
     */
    Map<String, Object> parameters();
}
