package com.raditha.unnest.model;

/**
 * Flags attached to a region outcome for caller review.
 */
public enum OutcomeFlag {
    /** accepted but below the acceptance confidence; left unapplied */
    LOW_CONFIDENCE,

    /** accepted after one or more repair attempts */
    REPAIRED,

    /** skipped because an earlier candidate already rewrote its range */
    OVERLAPS_REWRITTEN_REGION,

    /** at least one subroutine name came from the suggestion provider */
    SUGGESTION_APPLIED
}
