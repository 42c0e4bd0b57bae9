package com.oapce.sentinel.service;

import com.oapce.sentinel.config.SentinelProperties;
import com.oapce.sentinel.model.DetectionRunResult;
import com.oapce.sentinel.trace.RequestContextHolder;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic detection over the configured metrics. One metric failing never stops the others.
 */
@Component
public class ScheduledDetectionJob {

    private static final Logger log = LoggerFactory.getLogger(ScheduledDetectionJob.class);

    private final AnomalyDetectionService detectionService;
    private final SentinelProperties.Schedule schedule;

    public ScheduledDetectionJob(AnomalyDetectionService detectionService, SentinelProperties properties) {
        this.detectionService = detectionService;
        this.schedule = properties.schedule();
    }

    @Scheduled(cron = "${sentinel.schedule.cron:0 0 * * * *}")
    public void runOnSchedule() {
        if (!schedule.enabledFlag()) {
            log.debug("Scheduled detection disabled (sentinel.schedule.enabled=false)");
            return;
        }
        runAll(schedule.metrics(), schedule.lookbackDays());
    }

    /**
     * Runs each metric under one shared trace id so a scheduled pass can be followed in the logs.
     */
    public Map<String, DetectionRunResult> runAll(List<String> metrics, int lookbackDays) {
        Map<String, DetectionRunResult> results = new LinkedHashMap<>();
        int totalDetected = 0;
        String runId = "schedule-" + UUID.randomUUID();
        for (String metric : metrics) {
            try (RequestContextHolder.Scope ignored = RequestContextHolder.open(runId, metric)) {
                DetectionRunResult result = detectionService.runDetection(metric, lookbackDays);
                results.put(metric, result);
                totalDetected += result.anomaliesDetected();
            } catch (RuntimeException ex) {
                log.error("Scheduled detection failed for {}", metric, ex);
            }
        }
        log.info("Scheduled detection ({} metrics, lookback {} days): {} anomalies detected",
                metrics.size(), lookbackDays, totalDetected);
        return results;
    }
}
