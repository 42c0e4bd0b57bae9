package com.oapce.sentinel.modelrun;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oapce.sentinel.detection.ModelRunRecorder;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Ledger of detector fits. Recording is best effort: a failure to write the ledger is logged and
 * never interrupts detection.
 */
@Service
public class ModelRunService implements ModelRunRecorder {

    private static final Logger log = LoggerFactory.getLogger(ModelRunService.class);
    private static final int MAX_LIMIT = 200;

    private final JpaModelRunRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ModelRunService(JpaModelRunRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void recordRun(String modelName, Map<String, Object> parameters, int datasetSize) {
        Instant now = clock.instant();
        try {
            String json = parameters == null || parameters.isEmpty() ? null : objectMapper.writeValueAsString(parameters);
            repository.save(new ModelRunEntity(modelName, LocalDate.ofInstant(now, ZoneOffset.UTC), json, datasetSize, now));
        } catch (JsonProcessingException | DataAccessException ex) {
            log.error("Model run ledger: failed to record run of {}", modelName, ex);
        }
    }

    @Transactional(readOnly = true)
    public List<ModelRun> latestRuns(Optional<String> modelName, int limit) {
        int safeLimit = Math.min(MAX_LIMIT, Math.max(1, limit));
        return repository.findLatest(modelName.filter(name -> !name.isBlank()).orElse(null), PageRequest.of(0, safeLimit))
                .stream()
                .map(this::toModel)
                .toList();
    }

    private ModelRun toModel(ModelRunEntity entity) {
        return new ModelRun(
                entity.getId(),
                entity.getModelName(),
                entity.getTrainingDate(),
                entity.getParameters(),
                entity.getDatasetSize(),
                entity.getPrecision(),
                entity.getRecall(),
                entity.getF1Score(),
                entity.getCreatedAt()
        );
    }
}
