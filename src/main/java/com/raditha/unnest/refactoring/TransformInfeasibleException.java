package com.raditha.unnest.refactoring;

/**
 * Raised when no safe rewrite exists for a region, or a pattern cannot be applied to it.
 */
public class TransformInfeasibleException extends Exception {

    public TransformInfeasibleException(String reason) {
        super(reason);
    }
}
