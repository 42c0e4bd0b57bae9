package com.oapce.sentinel.detection;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.Severity;
import com.oapce.sentinel.model.TimeSeriesPoint;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

/**
 * Fits an additive model (linear trend, day-of-week effects and yearly Fourier terms) by least
 * squares and flags days whose in-sample residual exceeds the configured number of residual
 * standard deviations.
 */
@Component
public class SeasonalResidualDetector implements Detector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalResidualDetector.class);

    static final String REGRESSION_CLASS = "org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression";
    static final int WEEKLY_MIN_SPAN_DAYS = 14;
    static final int YEARLY_MIN_SPAN_DAYS = 730;
    private static final double DAYS_PER_YEAR = 365.25d;
    private static final double DEGENERATE_SIGMA_RATIO = 1e-9d;

    private final SentinelProperties.Seasonal config;
    private final boolean libraryPresent;

    @Autowired
    public SeasonalResidualDetector(SentinelProperties properties) {
        this(properties.detection().seasonal(),
                ClassUtils.isPresent(REGRESSION_CLASS, SeasonalResidualDetector.class.getClassLoader()));
    }

    SeasonalResidualDetector(SentinelProperties.Seasonal config, boolean libraryPresent) {
        this.config = config;
        this.libraryPresent = libraryPresent;
        if (!libraryPresent) {
            log.warn("Seasonal residual detector: {} not on the classpath, detector disabled", REGRESSION_CLASS);
        }
    }

    @Override
    public DetectionMethod method() {
        return DetectionMethod.SEASONAL_RESIDUAL;
    }

    @Override
    public boolean isAvailable() {
        return libraryPresent && config.enabledFlag();
    }

    @Override
    public DetectorOutcome detect(List<TimeSeriesPoint> series, String metricName) {
        if (!isAvailable()) {
            return DetectorOutcome.unavailable(method(),
                    libraryPresent ? "seasonal residual disabled by configuration" : "regression library not available");
        }
        double[] actual = SeriesStatistics.values(series);
        double[][] design = designMatrix(series);
        double[] residuals;
        try {
            OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression();
            regression.newSampleData(actual, design);
            residuals = regression.estimateResiduals();
        } catch (MathIllegalArgumentException ex) {
            log.warn("Seasonal residual: model fit failed for {}: {}", metricName, ex.getMessage());
            return DetectorOutcome.failed(method(), "model fit failed: " + ex.getMessage());
        }

        double sigma = new StandardDeviation(true).evaluate(residuals);
        if (isDegenerate(sigma, actual)) {
            log.info("Seasonal residual: residual spread is zero for {}, nothing to flag", metricName);
            return DetectorOutcome.completed(method(), List.of());
        }
        double k = config.residualSigmaThreshold();
        double band = k * sigma;
        List<AnomalyCandidate> anomalies = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            double residual = residuals[i];
            double magnitude = Math.abs(residual);
            if (magnitude <= band) {
                continue;
            }
            double fitted = actual[i] - residual;
            TimeSeriesPoint point = series.get(i);
            anomalies.add(new AnomalyCandidate(
                    point.date(),
                    metricName,
                    point.value(),
                    new AnomalyCandidate.ExpectedRange(fitted - band, fitted + band),
                    magnitude > (k + 1d) * sigma ? Severity.CRITICAL : Severity.HIGH,
                    method(),
                    magnitude / sigma,
                    String.format(Locale.ROOT, "Anomaly detected by seasonal model. Residual: %.2f (%.1fσ)",
                            residual, magnitude / sigma)
            ));
        }
        log.info("Seasonal residual: {} anomalies in {} ({} points)", anomalies.size(), metricName, series.size());
        return DetectorOutcome.completed(method(), anomalies);
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("seasonality_mode", "additive");
        parameters.put("weekly_seasonality", true);
        parameters.put("yearly_seasonality", true);
        parameters.put("yearly_fourier_order", config.yearlyFourierOrder());
        parameters.put("residual_sigma_threshold", config.residualSigmaThreshold());
        return parameters;
    }

    /**
     * Regressors per day, without the intercept column (added by the regression). Seasonal terms
     * are only included once the series covers enough periods to estimate them.
     */
    double[][] designMatrix(List<TimeSeriesPoint> series) {
        LocalDate start = series.get(0).date();
        long span = ChronoUnit.DAYS.between(start, series.get(series.size() - 1).date()) + 1;
        boolean weekly = span >= WEEKLY_MIN_SPAN_DAYS;
        int yearlyOrder = span >= YEARLY_MIN_SPAN_DAYS ? config.yearlyFourierOrder() : 0;
        int columns = 1 + (weekly ? 6 : 0) + 2 * yearlyOrder;
        double trendScale = Math.max(1d, span - 1d);

        double[][] design = new double[series.size()][columns];
        for (int i = 0; i < series.size(); i++) {
            LocalDate date = series.get(i).date();
            double[] row = design[i];
            int column = 0;
            row[column++] = ChronoUnit.DAYS.between(start, date) / trendScale;
            if (weekly) {
                DayOfWeek dayOfWeek = date.getDayOfWeek();
                // Monday is the baseline level absorbed by the intercept
                for (int d = 2; d <= 7; d++) {
                    row[column++] = dayOfWeek.getValue() == d ? 1d : 0d;
                }
            }
            double yearPhase = 2d * Math.PI * date.getDayOfYear() / DAYS_PER_YEAR;
            for (int order = 1; order <= yearlyOrder; order++) {
                row[column++] = Math.sin(order * yearPhase);
                row[column++] = Math.cos(order * yearPhase);
            }
        }
        return design;
    }

    private static boolean isDegenerate(double sigma, double[] actual) {
        if (!Double.isFinite(sigma) || sigma <= 0) {
            return true;
        }
        double meanAbs = 0d;
        for (double value : actual) {
            meanAbs += Math.abs(value);
        }
        meanAbs /= actual.length;
        return sigma <= DEGENERATE_SIGMA_RATIO * Math.max(1d, meanAbs);
    }
}
