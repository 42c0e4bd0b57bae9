package com.oapce.sentinel.detection;

import java.util.Map;

/**
 * Receives a note of every completed detector fit.
 */
@FunctionalInterface
public interface ModelRunRecorder {

    ModelRunRecorder NOOP = (modelName, parameters, datasetSize) -> { };

    void recordRun(String modelName, Map<String, Object> parameters, int datasetSize);
}
