package com.oapce.sentinel.service;

import com.oapce.sentinel.alert.AlertLifecycleService;
import com.oapce.sentinel.alert.AlertNotFoundException;
import com.oapce.sentinel.alert.AlertStore;
import com.oapce.sentinel.detection.CandidateAggregator;
import com.oapce.sentinel.detection.DetectionEnsemble;
import com.oapce.sentinel.detection.EnsembleRun;
import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DashboardSummary;
import com.oapce.sentinel.model.DetectedAnomaly;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.DetectionRunResult;
import com.oapce.sentinel.model.OperationResult;
import com.oapce.sentinel.model.TimeSeriesPoint;
import com.oapce.sentinel.timeseries.InsufficientDataException;
import com.oapce.sentinel.timeseries.MetricSeriesProvider;
import com.oapce.sentinel.timeseries.TimeSeriesBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for dashboards and schedulers: runs the detection pipeline for a metric and exposes
 * the alert lifecycle with structured success/failure results.
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final MetricSeriesProvider seriesProvider;
    private final TimeSeriesBuilder timeSeriesBuilder;
    private final DetectionEnsemble ensemble;
    private final CandidateAggregator aggregator;
    private final AlertStore alertStore;
    private final AlertLifecycleService lifecycleService;

    public AnomalyDetectionService(
            MetricSeriesProvider seriesProvider,
            TimeSeriesBuilder timeSeriesBuilder,
            DetectionEnsemble ensemble,
            CandidateAggregator aggregator,
            AlertStore alertStore,
            AlertLifecycleService lifecycleService
    ) {
        this.seriesProvider = seriesProvider;
        this.timeSeriesBuilder = timeSeriesBuilder;
        this.ensemble = ensemble;
        this.aggregator = aggregator;
        this.alertStore = alertStore;
        this.lifecycleService = lifecycleService;
    }

    public DetectionRunResult runDetection(String metricName, int lookbackDays) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
        if (lookbackDays <= 0) {
            throw new IllegalArgumentException("lookbackDays must be positive");
        }
        String metric = metricName.trim();
        log.info("Detecting anomalies in {} (last {} days)", metric, lookbackDays);

        List<TimeSeriesPoint> series;
        try {
            series = timeSeriesBuilder.build(seriesProvider.getDailySeries(metric, lookbackDays), lookbackDays);
        } catch (InsufficientDataException ex) {
            log.info("Detection skipped for {}: {}", metric, ex.getMessage());
            return DetectionRunResult.insufficientData(metric, ex.distinctDays());
        }

        EnsembleRun run = ensemble.run(series, metric);
        List<AnomalyCandidate> aggregated = aggregator.aggregate(run.candidates());

        List<DetectedAnomaly> saved = new ArrayList<>();
        for (AnomalyCandidate candidate : aggregated) {
            Optional<Alert> alert = alertStore.submit(candidate);
            alert.ifPresent(value -> saved.add(DetectedAnomaly.of(candidate, value)));
        }
        List<String> methodsUsed = run.methodsUsed().stream().map(DetectionMethod::wireName).toList();
        log.info("Detection finished for {}: points={}, detected={}, saved={}, methods={}",
                metric, series.size(), aggregated.size(), saved.size(), methodsUsed);
        return new DetectionRunResult(true, metric, series.size(), aggregated.size(), saved.size(),
                methodsUsed, saved, null);
    }

    public List<Alert> listAlerts(Optional<String> metricName, Optional<AlertStatus> status, int sinceDays) {
        return lifecycleService.query(metricName, status, sinceDays);
    }

    public OperationResult acknowledgeAlert(long alertId, Optional<String> assignedTo, Optional<String> notes) {
        try {
            lifecycleService.acknowledge(alertId, assignedTo, notes);
            return OperationResult.ok("Alert " + alertId + " acknowledged");
        } catch (AlertNotFoundException ex) {
            log.warn("Acknowledge rejected: {}", ex.getMessage());
            return OperationResult.failure(ex.getMessage());
        }
    }

    public OperationResult resolveAlert(long alertId, String resolution) {
        try {
            lifecycleService.resolve(alertId, resolution);
            return OperationResult.ok("Alert " + alertId + " resolved");
        } catch (AlertNotFoundException ex) {
            log.warn("Resolve rejected: {}", ex.getMessage());
            return OperationResult.failure(ex.getMessage());
        }
    }

    public DashboardSummary getDashboardSummary(int recentDays) {
        return lifecycleService.dashboardSummary(recentDays);
    }
}
