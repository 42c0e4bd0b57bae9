package com.oapce.sentinel.config;

import com.oapce.sentinel.detection.DetectionEnsemble;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final SentinelProperties props;
    private final DetectionEnsemble ensemble;

    public StartupDiagnostics(SentinelProperties props, DetectionEnsemble ensemble) {
        this.props = props;
        this.ensemble = ensemble;
    }

    @PostConstruct
    void logConfig() {
        var detection = props.detection();
        var forest = detection.isolationForest();
        var seasonal = detection.seasonal();
        var zscore = detection.rollingZscore();
        log.info("Detection config: minDistinctDays={}, detectors={}, unavailable={}",
                detection.minDistinctDays(), ensemble.methods(), ensemble.unavailableMethods());
        log.info("Isolation forest: contamination={}, nEstimators={}, maxFeatures={}, maxSamples={}, seed={}",
                forest.contamination(), forest.nEstimators(), forest.maxFeatures(), forest.maxSamples(), forest.seed());
        log.info("Seasonal residual: sigmaThreshold={}, yearlyFourierOrder={}; rolling z-score: window={}, threshold={}",
                seasonal.residualSigmaThreshold(), seasonal.yearlyFourierOrder(), zscore.windowSize(), zscore.threshold());

        var alerts = props.alerts();
        log.info("Alert config: dedupWindowHours={}, dedupAnchor={}, submitRetries={}",
                alerts.dedupWindowHours(), alerts.dedupAnchor(), alerts.submitRetries());

        var schedule = props.schedule();
        log.info("Schedule config: enabled={}, metrics={}, lookbackDays={}",
                schedule.enabledFlag(), schedule.metrics(), schedule.lookbackDays());
    }
}
