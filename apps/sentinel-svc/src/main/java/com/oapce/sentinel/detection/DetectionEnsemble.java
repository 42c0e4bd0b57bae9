package com.oapce.sentinel.detection;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.DetectionMethod;
import com.oapce.sentinel.model.TimeSeriesPoint;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs every available detector over the same series. Availability is resolved once at
 * construction; detectors that are unavailable then are never invoked.
 */
@Component
public class DetectionEnsemble {

    private static final Logger log = LoggerFactory.getLogger(DetectionEnsemble.class);

    private final List<Detector> detectors;
    private final List<DetectionMethod> unavailable;
    private final ModelRunRecorder modelRunRecorder;
    private final ExecutorService executor;

    @Autowired
    public DetectionEnsemble(List<Detector> detectors, SentinelProperties properties, ModelRunRecorder modelRunRecorder) {
        this(detectors, properties.detection().parallelismOrDefault(detectors.size()), modelRunRecorder);
    }

    public DetectionEnsemble(List<Detector> detectors, int parallelism, ModelRunRecorder modelRunRecorder) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        List<Detector> available = new ArrayList<>();
        List<DetectionMethod> skipped = new ArrayList<>();
        for (Detector detector : ordered(detectors)) {
            if (detector.isAvailable()) {
                available.add(detector);
            } else {
                skipped.add(detector.method());
                log.warn("Detection ensemble: detector {} unavailable, skipping", detector.method().wireName());
            }
        }
        this.detectors = List.copyOf(available);
        this.unavailable = List.copyOf(skipped);
        this.modelRunRecorder = modelRunRecorder != null ? modelRunRecorder : ModelRunRecorder.NOOP;
        this.executor = parallelism > 1 && this.detectors.size() > 1
                ? Executors.newFixedThreadPool(Math.min(parallelism, this.detectors.size()), threadFactory())
                : null;
        log.info("Detection ensemble ready: detectors={}, unavailable={}, parallel={}",
                methods(), unavailable, executor != null);
    }

    public EnsembleRun run(List<TimeSeriesPoint> series, String metricName) {
        List<TimeSeriesPoint> snapshot = List.copyOf(series);
        List<DetectorOutcome> outcomes = new ArrayList<>(detectors.size());
        if (executor == null) {
            for (Detector detector : detectors) {
                outcomes.add(invoke(detector, snapshot, metricName));
            }
        } else {
            List<CompletableFuture<DetectorOutcome>> futures = new ArrayList<>(detectors.size());
            for (Detector detector : detectors) {
                futures.add(CompletableFuture.supplyAsync(() -> invoke(detector, snapshot, metricName), executor));
            }
            for (CompletableFuture<DetectorOutcome> future : futures) {
                outcomes.add(future.join());
            }
        }
        for (DetectorOutcome outcome : outcomes) {
            if (outcome.isCompleted()) {
                recordRun(outcome.method(), snapshot.size());
            }
        }
        return new EnsembleRun(outcomes);
    }

    public List<DetectionMethod> methods() {
        return detectors.stream().map(Detector::method).toList();
    }

    public List<DetectionMethod> unavailableMethods() {
        return unavailable;
    }

    @PreDestroy
    public void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private DetectorOutcome invoke(Detector detector, List<TimeSeriesPoint> series, String metricName) {
        DetectorOutcome outcome;
        try {
            outcome = detector.detect(series, metricName);
        } catch (RuntimeException ex) {
            log.warn("Detection ensemble: detector {} failed for {}", detector.method().wireName(), metricName, ex);
            return DetectorOutcome.failed(detector.method(), ex.getMessage());
        }
        if (!outcome.isCompleted()) {
            log.warn("Detection ensemble: detector {} did not complete for {} ({}): {}",
                    detector.method().wireName(), metricName, outcome.status(), outcome.reason());
        }
        return outcome;
    }

    private void recordRun(DetectionMethod method, int datasetSize) {
        Detector detector = detectors.stream().filter(d -> d.method() == method).findFirst().orElse(null);
        if (detector == null) {
            return;
        }
        modelRunRecorder.recordRun(method.wireName(), detector.parameters(), datasetSize);
    }

    private static List<Detector> ordered(List<Detector> detectors) {
        List<Detector> ordered = new ArrayList<>(detectors);
        ordered.sort((a, b) -> a.method().compareTo(b.method()));
        return ordered;
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
