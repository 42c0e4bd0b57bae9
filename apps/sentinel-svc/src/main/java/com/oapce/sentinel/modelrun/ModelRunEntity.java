package com.oapce.sentinel.modelrun;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "anomaly_model_runs",
        indexes = {
                @Index(name = "idx_model_runs_model_name", columnList = "model_name"),
                @Index(name = "idx_model_runs_training_date", columnList = "training_date")
        })
public class ModelRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Column(name = "training_date", nullable = false)
    private LocalDate trainingDate;

    @Column(name = "parameters", columnDefinition = "text")
    private String parameters;

    @Column(name = "dataset_size")
    private Integer datasetSize;

    @Column(name = "precision_score")
    private Double precision;

    @Column(name = "recall_score")
    private Double recall;

    @Column(name = "f1_score")
    private Double f1Score;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    protected ModelRunEntity() {}

    public ModelRunEntity(String modelName, LocalDate trainingDate, String parameters, Integer datasetSize, Instant createdAt) {
        this.modelName = modelName;
        this.trainingDate = trainingDate;
        this.parameters = parameters;
        this.datasetSize = datasetSize;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }
    public String getModelName() { return modelName; }
    public LocalDate getTrainingDate() { return trainingDate; }
    public String getParameters() { return parameters; }
    public Integer getDatasetSize() { return datasetSize; }
    public Double getPrecision() { return precision; }
    public Double getRecall() { return recall; }
    public Double getF1Score() { return f1Score; }
    public Instant getCreatedAt() { return createdAt; }
}
