package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.Alert;
import com.oapce.sentinel.model.AlertStatus;
import com.oapce.sentinel.model.Severity;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@Primary
public class JpaAlertRepositoryAdapter implements AlertRepository {

    private final JpaAlertRepository jpaAlertRepository;

    public JpaAlertRepositoryAdapter(JpaAlertRepository jpaAlertRepository) {
        this.jpaAlertRepository = jpaAlertRepository;
    }

    @Override
    @Transactional
    public Alert insert(Alert alert) {
        if (alert.id() != null) {
            throw new IllegalArgumentException("new alert must not carry an id");
        }
        AlertEntity entity = new AlertEntity(alert.metricName(), alert.createdAt());
        apply(alert, entity);
        return toModel(jpaAlertRepository.saveAndFlush(entity));
    }

    @Override
    @Transactional
    public Optional<Alert> update(long alertId, UnaryOperator<Alert> mutation) {
        Optional<AlertEntity> existing = jpaAlertRepository.findByIdForUpdate(alertId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        AlertEntity entity = existing.get();
        Alert updated = mutation.apply(toModel(entity));
        apply(updated, entity);
        try {
            return Optional.of(toModel(jpaAlertRepository.saveAndFlush(entity)));
        } catch (ObjectOptimisticLockingFailureException ex) {
            throw new ConcurrencyConflictException("Alert " + alertId + " was modified concurrently", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findById(long alertId) {
        return jpaAlertRepository.findById(alertId).map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findLatestByMetricSince(String metricName, Instant since) {
        return jpaAlertRepository
                .findFirstByMetricNameAndDetectedAtGreaterThanEqualOrderByDetectedAtDescIdDesc(metricName, since)
                .map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Alert> findLatestByMetricObservedBetween(String metricName, LocalDate from, LocalDate to) {
        return jpaAlertRepository
                .findFirstByMetricNameAndObservedOnBetweenOrderByDetectedAtDescIdDesc(metricName, from, to)
                .map(this::toModel);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Alert> search(Optional<String> metricName, Optional<AlertStatus> status, Instant since, int limit) {
        Pageable pageable = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
        return jpaAlertRepository.search(metricName.orElse(null), status.orElse(null), since, pageable)
                .stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SeverityStatusCount> countBySeverityAndStatus() {
        return jpaAlertRepository.countGroupedBySeverityAndStatus().stream()
                .map(row -> new SeverityStatusCount((Severity) row[0], (AlertStatus) row[1], ((Number) row[2]).longValue()))
                .toList();
    }

    private void apply(Alert alert, AlertEntity entity) {
        entity.setMetricValue(alert.metricValue());
        entity.setExpectedRangeMin(alert.expectedRangeMin());
        entity.setExpectedRangeMax(alert.expectedRangeMax());
        entity.setSeverity(alert.severity());
        entity.setStatus(alert.status());
        entity.setDetectionMethod(alert.detectionMethod());
        entity.setAssignedTo(alert.assignedTo());
        entity.setNotes(alert.notes());
        entity.setObservedOn(alert.observedOn());
        entity.setDetectedAt(alert.timestamp());
        entity.setUpdatedAt(alert.updatedAt());
    }

    private Alert toModel(AlertEntity entity) {
        return new Alert(
                entity.getId(),
                entity.getMetricName(),
                entity.getMetricValue(),
                entity.getExpectedRangeMin(),
                entity.getExpectedRangeMax(),
                entity.getSeverity(),
                entity.getStatus(),
                entity.getDetectionMethod(),
                entity.getAssignedTo(),
                entity.getNotes(),
                entity.getObservedOn(),
                entity.getDetectedAt(),
                entity.getCreatedAt(),
                entity.getUpdatedAt()
        );
    }
}
