package com.raditha.unnest.model;

/**
 * Recoverable failure categories. None of them aborts processing of other regions or units.
 */
public enum ErrorKind {
    /** the adapter could not build a consistent block tree */
    MALFORMED_STRUCTURE,

    /** no safe pattern exists for the region */
    TRANSFORM_INFEASIBLE,

    /** the repair loop ran out of attempts or had nothing left to try */
    VALIDATION_EXHAUSTED
}
