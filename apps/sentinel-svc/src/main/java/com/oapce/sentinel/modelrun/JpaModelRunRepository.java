package com.oapce.sentinel.modelrun;

import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaModelRunRepository extends JpaRepository<ModelRunEntity, Long> {

    @Query("SELECT m FROM ModelRunEntity m WHERE (:modelName IS NULL OR m.modelName = :modelName) ORDER BY m.createdAt DESC, m.id DESC")
    List<ModelRunEntity> findLatest(@Param("modelName") String modelName, Pageable pageable);
}
