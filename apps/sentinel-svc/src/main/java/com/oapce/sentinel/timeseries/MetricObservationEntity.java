package com.oapce.sentinel.timeseries;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "metric_observations",
        indexes = @Index(name = "idx_metric_observations_metric_day", columnList = "metric_name, observed_on"))
public class MetricObservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "metric_name", nullable = false, length = 100)
    private String metricName;

    @Column(name = "observed_on", nullable = false)
    private LocalDate observedOn;

    @Column(name = "amount", nullable = false, precision = 18, scale = 2)
    private BigDecimal amount;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    protected MetricObservationEntity() {}

    public MetricObservationEntity(String metricName, LocalDate observedOn, BigDecimal amount, Instant recordedAt) {
        this.metricName = metricName;
        this.observedOn = observedOn;
        this.amount = amount;
        this.recordedAt = recordedAt;
    }

    public Long getId() { return id; }
    public String getMetricName() { return metricName; }
    public LocalDate getObservedOn() { return observedOn; }
    public BigDecimal getAmount() { return amount; }
    public Instant getRecordedAt() { return recordedAt; }
}
