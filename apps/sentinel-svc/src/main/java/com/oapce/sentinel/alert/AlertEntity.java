package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.Severity;
import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "anomaly_alerts",
        indexes = {
                @Index(name = "idx_anomaly_alerts_metric_detected_at", columnList = "metric_name, detected_at"),
                @Index(name = "idx_anomaly_alerts_detected_at", columnList = "detected_at")
        })
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private double metricValue;

    @Column(name = "expected_range_min")
    private Double expectedRangeMin;

    @Column(name = "expected_range_max")
    private Double expectedRangeMax;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private AlertStatus status;

    @Column(name = "detection_method", length = 50)
    private String detectionMethod;

    @Column(name = "assigned_to", length = 100)
    private String assignedTo;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "observed_on")
    private LocalDate observedOn;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // Default constructor for JPA
    protected AlertEntity() {}

    public AlertEntity(String metricName, Instant createdAt) {
        this.metricName = metricName;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public long getVersion() { return version; }

    public String getMetricName() { return metricName; }

    public double getMetricValue() { return metricValue; }
    public void setMetricValue(double metricValue) { this.metricValue = metricValue; }

    public Double getExpectedRangeMin() { return expectedRangeMin; }
    public void setExpectedRangeMin(Double expectedRangeMin) { this.expectedRangeMin = expectedRangeMin; }

    public Double getExpectedRangeMax() { return expectedRangeMax; }
    public void setExpectedRangeMax(Double expectedRangeMax) { this.expectedRangeMax = expectedRangeMax; }

    public Severity getSeverity() { return severity; }
    public void setSeverity(Severity severity) { this.severity = severity; }

    public AlertStatus getStatus() { return status; }
    public void setStatus(AlertStatus status) { this.status = status; }

    public String getDetectionMethod() { return detectionMethod; }
    public void setDetectionMethod(String detectionMethod) { this.detectionMethod = detectionMethod; }

    public String getAssignedTo() { return assignedTo; }
    public void setAssignedTo(String assignedTo) { this.assignedTo = assignedTo; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public LocalDate getObservedOn() { return observedOn; }
    public void setObservedOn(LocalDate observedOn) { this.observedOn = observedOn; }

    public Instant getDetectedAt() { return detectedAt; }
    public void setDetectedAt(Instant detectedAt) { this.detectedAt = detectedAt; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
