package com.raditha.unnest.model;

/**
 * A maximal chain of nested conditionals at or above the depth threshold.
 *
 * @param root        the outermost conditional of the chain
 * @param maxDepth    deepest chain level reached inside the root
 * @param severity    severity derived from the depth
 * @param span        source range of the root conditional
 * @param fingerprint structural fingerprint
 */
public record ConditionalRegion(
        Block root,
        int maxDepth,
        Severity severity,
        Span span,
        RegionFingerprint fingerprint) {

    /**
     * Format region summary for display.
     */
    public String formatSummary() {
        return String.format("%s depth %d (%s), %d branches",
                span.toDisplayString(), maxDepth, severity.label(), fingerprint.branchCount());
    }
}
