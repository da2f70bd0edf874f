package com.raditha.unnest.config;

/**
 * Configuration for nested conditional detection and flattening.
 *
 * @param depthThreshold          minimum chain depth reported as a region
 * @param maxRepairAttempts       repair attempts allowed per candidate
 * @param acceptanceConfidence    minimum confidence for a candidate to be applied (0.0-1.0)
 * @param mediumSeverityDepth     depth classified as medium severity
 * @param highSeverityDepth       depth from which regions are high severity
 * @param maxPasses               detection passes per unit, re-detecting on rewritten text
 * @param suggestionTimeoutMillis upper bound for a single suggestion lookup
 */
public record DetectionConfig(
        int depthThreshold,
        int maxRepairAttempts,
        double acceptanceConfidence,
        int mediumSeverityDepth,
        int highSeverityDepth,
        int maxPasses,
        long suggestionTimeoutMillis) {

    public static final int DEFAULT_DEPTH_THRESHOLD = 3;
    public static final int DEFAULT_MAX_REPAIR_ATTEMPTS = 3;
    public static final double DEFAULT_ACCEPTANCE_CONFIDENCE = 0.5;
    public static final long DEFAULT_SUGGESTION_TIMEOUT_MILLIS = 200;

    /**
     * Validate configuration.
     */
    public DetectionConfig {
        if (depthThreshold < 2) {
            throw new IllegalArgumentException("depthThreshold must be >= 2");
        }
        if (maxRepairAttempts < 0) {
            throw new IllegalArgumentException("maxRepairAttempts must be >= 0");
        }
        if (acceptanceConfidence < 0.0 || acceptanceConfidence > 1.0) {
            throw new IllegalArgumentException("acceptanceConfidence must be between 0.0 and 1.0");
        }
        if (mediumSeverityDepth < 2 || highSeverityDepth <= mediumSeverityDepth) {
            throw new IllegalArgumentException("highSeverityDepth must be greater than mediumSeverityDepth (>= 2)");
        }
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be >= 1");
        }
        if (suggestionTimeoutMillis < 0) {
            throw new IllegalArgumentException("suggestionTimeoutMillis must be >= 0");
        }
    }

    /**
     * Default preset: threshold 3, three repair attempts, 50% acceptance confidence.
     */
    public static DetectionConfig defaults() {
        return new DetectionConfig(
                DEFAULT_DEPTH_THRESHOLD,
                DEFAULT_MAX_REPAIR_ATTEMPTS,
                DEFAULT_ACCEPTANCE_CONFIDENCE,
                3, // mediumSeverityDepth
                4, // highSeverityDepth
                1, // maxPasses
                DEFAULT_SUGGESTION_TIMEOUT_MILLIS);
    }

    /**
     * Strict preset: reports two-level chains and only applies confident rewrites.
     */
    public static DetectionConfig strict() {
        return new DetectionConfig(
                2,
                DEFAULT_MAX_REPAIR_ATTEMPTS,
                0.7,
                3,
                4,
                2, // a second pass catches chains exposed by the first
                DEFAULT_SUGGESTION_TIMEOUT_MILLIS);
    }

    /**
     * Lenient preset: only the deepest chains, any structurally valid rewrite is applied.
     */
    public static DetectionConfig lenient() {
        return new DetectionConfig(
                4,
                DEFAULT_MAX_REPAIR_ATTEMPTS,
                0.3,
                3,
                4,
                1,
                DEFAULT_SUGGESTION_TIMEOUT_MILLIS);
    }

    public DetectionConfig withDepthThreshold(int threshold) {
        return new DetectionConfig(threshold, maxRepairAttempts, acceptanceConfidence, mediumSeverityDepth,
                highSeverityDepth, maxPasses, suggestionTimeoutMillis);
    }

    public DetectionConfig withMaxRepairAttempts(int attempts) {
        return new DetectionConfig(depthThreshold, attempts, acceptanceConfidence, mediumSeverityDepth,
                highSeverityDepth, maxPasses, suggestionTimeoutMillis);
    }

    public DetectionConfig withAcceptanceConfidence(double confidence) {
        return new DetectionConfig(depthThreshold, maxRepairAttempts, confidence, mediumSeverityDepth,
                highSeverityDepth, maxPasses, suggestionTimeoutMillis);
    }

    public DetectionConfig withMaxPasses(int passes) {
        return new DetectionConfig(depthThreshold, maxRepairAttempts, acceptanceConfidence, mediumSeverityDepth,
                highSeverityDepth, passes, suggestionTimeoutMillis);
    }
}
