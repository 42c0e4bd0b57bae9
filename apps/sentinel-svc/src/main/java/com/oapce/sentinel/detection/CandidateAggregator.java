package com.oapce.sentinel.detection;

import com.oapce.sentinel.model.AnomalyCandidate;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Collapses candidates reported by several detectors for the same day and metric into the most
 * severe one. Among equally severe candidates the first one submitted wins.
 */
@Component
public class CandidateAggregator {

    private static final Comparator<AnomalyCandidate> BY_DAY_THEN_SEVERITY = Comparator
            .comparing(AnomalyCandidate::timestamp)
            .thenComparing(AnomalyCandidate::severity, Comparator.reverseOrder());

    public List<AnomalyCandidate> aggregate(List<AnomalyCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<AnomalyCandidate> sorted = new ArrayList<>(candidates);
        sorted.sort(BY_DAY_THEN_SEVERITY);

        Set<GroupKey> seen = new HashSet<>();
        List<AnomalyCandidate> kept = new ArrayList<>();
        for (AnomalyCandidate candidate : sorted) {
            if (seen.add(new GroupKey(candidate.timestamp(), candidate.metricName()))) {
                kept.add(candidate);
            }
        }
        return List.copyOf(kept);
    }

    private record GroupKey(LocalDate timestamp, String metricName) {
    }
}
