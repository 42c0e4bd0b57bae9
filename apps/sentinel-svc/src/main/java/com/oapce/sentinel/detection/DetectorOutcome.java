package com.oapce.sentinel.detection;

import com.oapce.sentinel.model.AnomalyCandidate;
import com.oapce.sentinel.model.DetectionMethod;
import java.util.List;

public record DetectorOutcome(
        DetectionMethod method,
        Status status,
        List<AnomalyCandidate> candidates,
        String reason
) {
    public enum Status {
        COMPLETED,
        UNAVAILABLE,
        FAILED
    }

    public DetectorOutcome {
        if (method == null) {
            throw new IllegalArgumentException("method must be provided");
        }
        if (status == null) {
            throw new IllegalArgumentException("status must be provided");
        }
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static DetectorOutcome completed(DetectionMethod method, List<AnomalyCandidate> candidates) {
        return new DetectorOutcome(method, Status.COMPLETED, candidates, null);
    }

    public static DetectorOutcome unavailable(DetectionMethod method, String reason) {
        return new DetectorOutcome(method, Status.UNAVAILABLE, List.of(), reason);
    }

    public static DetectorOutcome failed(DetectionMethod method, String reason) {
        return new DetectorOutcome(method, Status.FAILED, List.of(), reason);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
