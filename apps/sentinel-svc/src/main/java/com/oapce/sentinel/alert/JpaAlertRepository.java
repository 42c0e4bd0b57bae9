package com.oapce.sentinel.alert;

import com.oapce.sentinel.model.AlertStatus;
import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaAlertRepository extends JpaRepository<AlertEntity, Long> {

    Optional<AlertEntity> findFirstByMetricNameAndDetectedAtGreaterThanEqualOrderByDetectedAtDescIdDesc(
            String metricName, Instant since);

    Optional<AlertEntity> findFirstByMetricNameAndObservedOnBetweenOrderByDetectedAtDescIdDesc(
            String metricName, LocalDate from, LocalDate to);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AlertEntity a WHERE a.id = :id")
    Optional<AlertEntity> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            SELECT a FROM AlertEntity a
            WHERE (:metricName IS NULL OR a.metricName = :metricName)
              AND (:status IS NULL OR a.status = :status)
              AND a.detectedAt >= :since
            ORDER BY a.detectedAt DESC, a.id DESC
            """)
    List<AlertEntity> search(@Param("metricName") String metricName,
                             @Param("status") AlertStatus status,
                             @Param("since") Instant since,
                             Pageable pageable);

    @Query("SELECT a.severity, a.status, COUNT(a) FROM AlertEntity a GROUP BY a.severity, a.status")
    List<Object[]> countGroupedBySeverityAndStatus();
}
