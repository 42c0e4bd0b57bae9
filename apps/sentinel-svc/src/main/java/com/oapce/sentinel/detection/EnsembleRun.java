package com.oapce.sentinel.detection;

import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one ensemble pass over a series: every detector's outcome in registration order and
 * the raw, not yet aggregated, candidates of the detectors that completed.
 */
public record EnsembleRun(List<DetectorOutcome> outcomes) {

    public EnsembleRun {
        outcomes = List.copyOf(outcomes);
    }

    public List<DetectionMethod> methodsUsed() {
        return outcomes.stream()
                .filter(DetectorOutcome::isCompleted)
                .map(DetectorOutcome::method)
                .toList();
    }

    public List<AnomalyCandidate> candidates() {
        List<AnomalyCandidate> all = new ArrayList<>();
        for (DetectorOutcome outcome : outcomes) {
            if (outcome.isCompleted()) {
                all.addAll(outcome.candidates());
            }
        }
        return all;
    }
}
