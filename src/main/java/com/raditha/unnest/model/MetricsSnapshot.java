package com.raditha.unnest.model;

/**
 * Before and after measurements of one region.
 *
 * @param depthBefore    maximum chain depth before the rewrite
 * @param depthAfter     maximum chain depth inside the rewritten span
 * @param branchesBefore branch count before the rewrite
 * @param branchesAfter  branch count inside the rewritten span
 * @param confidence     heuristic reliability score (0.0-1.0)
 */
public record MetricsSnapshot(
        int depthBefore,
        int depthAfter,
        int branchesBefore,
        int branchesAfter,
        double confidence) {

    public MetricsSnapshot {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public int depthReduction() {
        return depthBefore - depthAfter;
    }

    /**
     * Format confidence as percentage.
     */
    public String formatConfidence() {
        return String.format("%.0f%%", confidence * 100);
    }
}
