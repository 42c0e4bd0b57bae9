package com.oapce.sentinel.controller;

import com.oapce.sentinel.alert.AlertLifecycleService;
import com.oapce.sentinel.controller.dto.AcknowledgeRequestDto;
import com.oapce.sentinel.controller.dto.AlertResponseDto;
import com.oapce.sentinel.controller.dto.AlertsListResponseDto;
import com.oapce.sentinel.controller.dto.DashboardSummaryResponseDto;
import com.oapce.sentinel.controller.dto.ResolveRequestDto;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.DashboardSummary;
import com.oapce.sentinel.model.OperationResult;
import com.oapce.sentinel.service.AnomalyDetectionService;
import com.oapce.sentinel.trace.RequestContextHolder;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class AlertsController {

    private final AnomalyDetectionService detectionService;
    private final AlertLifecycleService lifecycleService;

    public AlertsController(AnomalyDetectionService detectionService, AlertLifecycleService lifecycleService) {
        this.detectionService = detectionService;
        this.lifecycleService = lifecycleService;
    }

    @GetMapping("/alerts")
    public ResponseEntity<AlertsListResponseDto> listAlerts(
            @RequestParam(value = "metric", required = false) String metric,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "sinceDays", required = false, defaultValue = "30") int sinceDays
    ) {
        Optional<AlertStatus> statusFilter = Optional.ofNullable(status)
                .filter(value -> !value.isBlank())
                .map(AlertStatus::fromWireName);
        List<AlertResponseDto> alerts = detectionService.listAlerts(Optional.ofNullable(metric), statusFilter, sinceDays)
                .stream()
                .map(AlertResponseDto::from)
                .toList();
        return ResponseEntity.ok(new AlertsListResponseDto(alerts, alerts.size(), RequestContextHolder.currentTraceId()));
    }

    @GetMapping("/alerts/{alertId}")
    public ResponseEntity<AlertResponseDto> getAlert(@PathVariable("alertId") long alertId) {
        return ResponseEntity.ok(AlertResponseDto.from(lifecycleService.get(alertId)));
    }

    @PostMapping("/alerts/{alertId}/acknowledge")
    public ResponseEntity<OperationResult> acknowledge(
            @PathVariable("alertId") long alertId,
            @RequestBody(required = false) @Valid AcknowledgeRequestDto request
    ) {
        Optional<String> assignedTo = Optional.ofNullable(request).map(AcknowledgeRequestDto::assignedTo);
        Optional<String> notes = Optional.ofNullable(request).map(AcknowledgeRequestDto::notes);
        return respond(detectionService.acknowledgeAlert(alertId, assignedTo, notes));
    }

    @PostMapping("/alerts/{alertId}/resolve")
    public ResponseEntity<OperationResult> resolve(
            @PathVariable("alertId") long alertId,
            @RequestBody @Valid ResolveRequestDto request
    ) {
        return respond(detectionService.resolveAlert(alertId, request.resolution()));
    }

    @GetMapping("/dashboard")
    public ResponseEntity<DashboardSummaryResponseDto> dashboard(
            @RequestParam(value = "recentDays", required = false, defaultValue = "7") int recentDays
    ) {
        DashboardSummary summary = detectionService.getDashboardSummary(recentDays);
        Map<String, DashboardSummaryResponseDto.SeverityCountsDto> counts = new LinkedHashMap<>();
        summary.severityCounts().forEach((severity, value) -> counts.put(severity.wireName(),
                new DashboardSummaryResponseDto.SeverityCountsDto(value.total(), value.open(), value.acknowledged(), value.resolved())));
        List<AlertResponseDto> recent = summary.recent().stream().map(AlertResponseDto::from).toList();
        return ResponseEntity.ok(new DashboardSummaryResponseDto(counts, recent, summary.totalCount(),
                RequestContextHolder.currentTraceId()));
    }

    private ResponseEntity<OperationResult> respond(OperationResult result) {
        return result.success()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
    }
}
