package com.raditha.unnest.model;

/**
 * Outcome of re-indexing a candidate.
 *
 * @param valid               whether the candidate may be accepted
 * @param failure             failure category, {@link Failure#NONE} when valid
 * @param error               description of the failure, null when valid
 * @param depthAfter          maximum chain depth inside the rewritten span, -1 when the
 *                            text could not be indexed
 * @param extractionRoundTrip for method extraction, whether every subroutine and call site
 *                            re-indexed cleanly; true for the other patterns
 * @param reindexed           root block of the candidate text, null when indexing failed
 */
public record ValidationResult(
        boolean valid,
        Failure failure,
        String error,
        int depthAfter,
        boolean extractionRoundTrip,
        Block reindexed) {

    public static ValidationResult accepted(int depthAfter, Block reindexed) {
        return new ValidationResult(true, Failure.NONE, null, depthAfter, true, reindexed);
    }

    public static ValidationResult malformed(String error) {
        return new ValidationResult(false, Failure.MALFORMED_STRUCTURE, error, -1, false, null);
    }

    public static ValidationResult depthNotReduced(String error, int depthAfter, Block reindexed) {
        return new ValidationResult(false, Failure.DEPTH_NOT_REDUCED, error, depthAfter, true, reindexed);
    }

    public static ValidationResult roundTripFailed(String error, int depthAfter, Block reindexed) {
        return new ValidationResult(false, Failure.EXTRACTION_ROUND_TRIP, error, depthAfter, false, reindexed);
    }

    /**
     * Failure categories, which decide the repair heuristic that applies.
     */
    public enum Failure {
        NONE,
        MALFORMED_STRUCTURE,
        DEPTH_NOT_REDUCED,
        EXTRACTION_ROUND_TRIP
    }
}
