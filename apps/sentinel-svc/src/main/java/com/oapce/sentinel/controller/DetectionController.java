package com.oapce.sentinel.controller;

import com.oapce.sentinel.controller.dto.DetectionRunResponseDto;
import com.oapce.sentinel.controller.dto.ModelRunResponseDto;
import com.oapce.sentinel.controller.dto.ObservationRequestDto;
import com.oapce.sentinel.model.DailyRecord;
import com.oapce.sentinel.model.DetectionRunResult;
import com.oapce.sentinel.modelrun.ModelRunService;
import com.oapce.sentinel.service.AnomalyDetectionService;
import com.oapce.sentinel.timeseries.JpaMetricSeriesProvider;
import com.oapce.sentinel.trace.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/anomalies")
public class DetectionController {

    private final AnomalyDetectionService detectionService;
    private final JpaMetricSeriesProvider seriesProvider;
    private final ModelRunService modelRunService;

    public DetectionController(
            AnomalyDetectionService detectionService,
            JpaMetricSeriesProvider seriesProvider,
            ModelRunService modelRunService
    ) {
        this.detectionService = detectionService;
        this.seriesProvider = seriesProvider;
        this.modelRunService = modelRunService;
    }

    @PostMapping("/detect")
    public ResponseEntity<DetectionRunResponseDto> detect(
            @RequestParam("metric") String metric,
            @RequestParam(value = "lookbackDays", required = false, defaultValue = "90") int lookbackDays
    ) {
        DetectionRunResult result = detectionService.runDetection(metric, lookbackDays);
        return ResponseEntity.ok(new DetectionRunResponseDto(
                result.success(),
                result.metricName(),
                result.dataPoints(),
                result.anomaliesDetected(),
                result.anomaliesSaved(),
                result.methodsUsed(),
                result.anomalies(),
                result.reason(),
                RequestContextHolder.currentTraceId()
        ));
    }

    @PostMapping("/observations")
    public ResponseEntity<Map<String, Object>> recordObservations(
            @RequestBody List<@Valid ObservationRequestDto> observations
    ) {
        for (ObservationRequestDto observation : observations) {
            seriesProvider.record(observation.metricName(), observation.date(), observation.amount());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of(
                "recorded", observations.size(),
                "traceId", Optional.ofNullable(RequestContextHolder.currentTraceId()).orElse("")
        ));
    }

    @GetMapping("/metrics")
    public ResponseEntity<List<String>> metrics() {
        return ResponseEntity.ok(seriesProvider.metricNames());
    }

    @GetMapping("/metrics/series")
    public ResponseEntity<List<DailyRecord>> series(
            @RequestParam("metric") String metric,
            @RequestParam(value = "lookbackDays", required = false, defaultValue = "90") int lookbackDays
    ) {
        return ResponseEntity.ok(seriesProvider.getDailySeries(metric, lookbackDays));
    }

    @GetMapping("/model-runs")
    public ResponseEntity<List<ModelRunResponseDto>> modelRuns(
            @RequestParam(value = "model", required = false) String model,
            @RequestParam(value = "limit", required = false, defaultValue = "20") int limit
    ) {
        return ResponseEntity.ok(modelRunService.latestRuns(Optional.ofNullable(model), limit).stream()
                .map(run -> new ModelRunResponseDto(run.id(), run.modelName(), run.trainingDate(),
                        run.parameters(), run.datasetSize(), run.createdAt()))
                .toList());
    }
}
