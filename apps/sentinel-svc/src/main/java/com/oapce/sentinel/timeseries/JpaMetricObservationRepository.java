package com.oapce.sentinel.timeseries;

import java.time.LocalDate;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaMetricObservationRepository extends JpaRepository<MetricObservationEntity, Long> {

    @Query("SELECT o FROM MetricObservationEntity o WHERE o.metricName = :metricName AND o.observedOn >= :from ORDER BY o.observedOn ASC")
    List<MetricObservationEntity> findByMetricSince(@Param("metricName") String metricName,
                                                    @Param("from") LocalDate from);

    @Query("SELECT DISTINCT o.metricName FROM MetricObservationEntity o ORDER BY o.metricName")
    List<String> findMetricNames();
}
