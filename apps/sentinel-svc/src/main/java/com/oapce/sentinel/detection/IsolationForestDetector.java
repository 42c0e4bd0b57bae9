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
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Flags days whose standardized value is isolated unusually quickly by an isolation forest. The
 * decision threshold is calibrated so that the configured contamination share of the series
 * falls below it.
 */
@Component
public class IsolationForestDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    static final double HIGH_SEVERITY_SCORE = 0.5d;

    private final SentinelProperties.IsolationForest config;

    @Autowired
    public IsolationForestDetector(SentinelProperties properties) {
        this(properties.detection().isolationForest());
    }

    IsolationForestDetector(SentinelProperties.IsolationForest config) {
        this.config = config;
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.ISOLATION_FOREST;
    }

    @Override
    public boolean isAvailable() {
        return config.enabledFlag();
    }

    @Override
    public DetectorOutcome detect(List<TimeSeriesPoint> series, String metricName) {
        if (!isAvailable()) {
            return DetectorOutcome.unavailable(method(), "isolation forest disabled by configuration");
        }
        if (series.size() < 2) {
            return DetectorOutcome.completed(method(), List.of());
        }
        double[] values = SeriesStatistics.values(series);
        double[] scaled = SeriesStatistics.standardize(values);
        double[][] features = new double[scaled.length][];
        for (int i = 0; i < scaled.length; i++) {
            features[i] = new double[] {scaled[i]};
        }

        IsolationForest forest = IsolationForest.fit(features, config.nEstimators(), config.maxSamples(),
                config.maxFeatures(), new Well19937c(config.seed()));
        double[] scoreSamples = forest.scoreSamples(features);
        double offset = SeriesStatistics.percentile(scoreSamples, 100d * config.contamination());

        double expectedMin = SeriesStatistics.percentile(values, 5d);
        double expectedMax = SeriesStatistics.percentile(values, 95d);
        List<AnomalyCandidate> anomalies = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double decision = scoreSamples[i] - offset;
            if (decision >= 0) {
                continue;
            }
            double magnitude = Math.abs(decision);
            TimeSeriesPoint point = series.get(i);
            anomalies.add(new AnomalyCandidate(
                    point.date(),
                    metricName,
                    point.value(),
                    new AnomalyCandidate.ExpectedRange(expectedMin, expectedMax),
                    magnitude > HIGH_SEVERITY_SCORE ? Severity.HIGH : Severity.MEDIUM,
                    method(),
                    magnitude,
                    String.format(Locale.ROOT, "Anomaly detected by isolation forest. Score: %.3f", decision)
            ));
        }
        log.info("Isolation forest: {} anomalies in {} ({} points)", anomalies.size(), metricName, series.size());
        return DetectorOutcome.completed(method(), anomalies);
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("contamination", config.contamination());
        parameters.put("n_estimators", config.nEstimators());
        parameters.put("max_features", config.maxFeatures());
        parameters.put("max_samples", config.maxSamples());
        parameters.put("random_state", config.seed());
        return parameters;
    }
}
