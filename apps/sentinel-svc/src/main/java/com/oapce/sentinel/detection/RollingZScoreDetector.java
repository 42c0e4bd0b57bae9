package com.oapce.sentinel.detection;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Z-score of each day against the trailing window that ends on that day. Days before the window
 * is full, and days whose window has zero spread, are never flagged.
 */
@Component
public class RollingZScoreDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(RollingZScoreDetector.class);

    static final double HIGH_SEVERITY_Z = 4.0d;

    private final SentinelProperties.RollingZscore config;

    @Autowired
    public RollingZScoreDetector(SentinelProperties properties) {
        this(properties.detection().rollingZscore());
    }

    RollingZScoreDetector(SentinelProperties.RollingZscore config) {
        this.config = config;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ROLLING_ZSCORE;
    }

    @Override
    public boolean isAvailable() {
        return config.enabledFlag();
    }

    @Override
    public DetectorOutcome detect(List<TimeSeriesPoint> series, String metricName) {
        if (!isAvailable()) {
            return DetectorOutcome.unavailable(method(), "rolling z-score disabled by configuration");
        }
        int windowSize = config.windowSize();
        double threshold = config.threshold();
        if (series.size() < windowSize) {
            log.debug("Rolling z-score: {} has {} points, window needs {}", metricName, series.size(), windowSize);
            return DetectorOutcome.completed(method(), List.of());
        }

        DescriptiveStatistics window = new DescriptiveStatistics(windowSize);
        List<AnomalyCandidate> anomalies = new ArrayList<>();
        for (TimeSeriesPoint point : series) {
            window.addValue(point.value());
            if (window.getN() < windowSize) {
                continue;
            }
            double mean = window.getMean();
            double std = window.getStandardDeviation();
            if (!(std > 0) || !Double.isFinite(std)) {
                continue;
            }
            double z = (point.value() - mean) / std;
            double magnitude = Math.abs(z);
            if (magnitude <= threshold) {
                continue;
            }
            anomalies.add(new AnomalyCandidate(
                    point.date(),
                    metricName,
                    point.value(),
                    new AnomalyCandidate.ExpectedRange(mean - threshold * std, mean + threshold * std),
                    magnitude > HIGH_SEVERITY_Z ? Severity.HIGH : Severity.MEDIUM,
                    method(),
                    magnitude,
                    String.format(Locale.ROOT, "Rolling z-score: %.2f (threshold: %.1f)", z, threshold)
            ));
        }
        log.info("Rolling z-score: {} anomalies in {} ({} points)", anomalies.size(), metricName, series.size());
        return DetectorOutcome.completed(method(), anomalies);
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("window_size", config.windowSize());
        parameters.put("threshold", config.threshold());
        return parameters;
    }
}
