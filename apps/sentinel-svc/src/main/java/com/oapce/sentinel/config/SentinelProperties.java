package com.oapce.sentinel.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "sentinel")
public record SentinelProperties(
        Detection detection,
        Alerts alerts,
        Schedule schedule
) {

    @ConstructorBinding
    public SentinelProperties {
        if (detection == null) {
            throw new IllegalArgumentException("detection configuration must be provided");
        }
        // alerts and schedule fall back to defaults; handled via accessor methods
    }

    public Alerts alerts() {
        return alerts != null ? alerts : Alerts.defaults();
    }

    public Schedule schedule() {
        return schedule != null ? schedule : Schedule.disabled();
    }

    public record Detection(
            Integer minDistinctDays,
            Integer parallelism,
            IsolationForest isolationForest,
            Seasonal seasonal,
            RollingZscore rollingZscore
    ) {
        public Detection {
            if (minDistinctDays == null) {
                minDistinctDays = 10;
            }
            if (minDistinctDays <= 0) {
                throw new IllegalArgumentException("minDistinctDays must be positive");
            }
            if (parallelism != null && parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            if (isolationForest == null) {
                isolationForest = IsolationForest.defaults();
            }
            if (seasonal == null) {
                seasonal = Seasonal.defaults();
            }
            if (rollingZscore == null) {
                rollingZscore = RollingZscore.defaults();
            }
        }

        public static Detection defaults() {
            return new Detection(null, null, null, null, null);
        }

        public int parallelismOrDefault(int detectorCount) {
            return parallelism != null ? parallelism : Math.max(1, detectorCount);
        }
    }

    public record IsolationForest(
            Boolean enabled,
            Double contamination,
            Integer nEstimators,
            Double maxFeatures,
            Integer maxSamples,
            Long seed
    ) {
        public IsolationForest {
            if (contamination == null) {
                contamination = 0.1d;
            }
            if (contamination <= 0 || contamination > 0.5) {
                throw new IllegalArgumentException("contamination must be in (0, 0.5]");
            }
            if (nEstimators == null) {
                nEstimators = 100;
            }
            if (nEstimators <= 0) {
                throw new IllegalArgumentException("nEstimators must be positive");
            }
            if (maxFeatures == null) {
                maxFeatures = 1.0d;
            }
            if (maxFeatures <= 0 || maxFeatures > 1.0) {
                throw new IllegalArgumentException("maxFeatures must be in (0, 1]");
            }
            if (maxSamples == null) {
                maxSamples = 256;
            }
            if (maxSamples < 2) {
                throw new IllegalArgumentException("maxSamples must be at least 2");
            }
            if (seed == null) {
                seed = 42L;
            }
        }

        public static IsolationForest defaults() {
            return new IsolationForest(null, null, null, null, null, null);
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record Seasonal(
            Boolean enabled,
            Double residualSigmaThreshold,
            Integer yearlyFourierOrder
    ) {
        public Seasonal {
            if (residualSigmaThreshold == null) {
                residualSigmaThreshold = 3.0d;
            }
            if (residualSigmaThreshold <= 0) {
                throw new IllegalArgumentException("residualSigmaThreshold must be positive");
            }
            if (yearlyFourierOrder == null) {
                yearlyFourierOrder = 3;
            }
            if (yearlyFourierOrder < 0) {
                throw new IllegalArgumentException("yearlyFourierOrder must not be negative");
            }
        }

        public static Seasonal defaults() {
            return new Seasonal(null, null, null);
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record RollingZscore(
            Boolean enabled,
            Integer windowSize,
            Double threshold
    ) {
        public RollingZscore {
            if (windowSize == null) {
                windowSize = 30;
            }
            if (windowSize < 2) {
                throw new IllegalArgumentException("windowSize must be at least 2");
            }
            if (threshold == null) {
                threshold = 3.0d;
            }
            if (threshold <= 0) {
                throw new IllegalArgumentException("threshold must be positive");
            }
        }

        public static RollingZscore defaults() {
            return new RollingZscore(null, null, null);
        }

        public boolean enabledFlag() {
            return enabled == null || enabled;
        }
    }

    public record Alerts(Integer dedupWindowHours, DedupAnchor dedupAnchor, Integer submitRetries) {
        public Alerts {
            if (dedupWindowHours == null) {
                dedupWindowHours = 24;
            }
            if (dedupWindowHours <= 0) {
                throw new IllegalArgumentException("dedupWindowHours must be positive");
            }
            if (dedupAnchor == null) {
                dedupAnchor = DedupAnchor.SUBMISSION_TIME;
            }
            if (submitRetries == null) {
                submitRetries = 3;
            }
            if (submitRetries <= 0) {
                throw new IllegalArgumentException("submitRetries must be positive");
            }
        }

        public static Alerts defaults() {
            return new Alerts(null, null, null);
        }
    }

    /**
     * Reference point of the alert dedup window.
     */
    public enum DedupAnchor {
        /** Window ends at the wall-clock time of submission. */
        SUBMISSION_TIME,
        /** Window is centred on the day the candidate was observed. */
        CANDIDATE_TIMESTAMP
    }

    public record Schedule(Boolean enabled, List<String> metrics, Integer lookbackDays) {
        public Schedule {
            if (metrics == null || metrics.isEmpty()) {
                metrics = List.of("sales_total", "collections_total");
            }
            if (lookbackDays == null) {
                lookbackDays = 90;
            }
            if (lookbackDays <= 0) {
                throw new IllegalArgumentException("lookbackDays must be positive");
            }
        }

        public static Schedule disabled() {
            return new Schedule(false, null, null);
        }

        public boolean enabledFlag() {
            return enabled != null && enabled;
        }
    }
}
