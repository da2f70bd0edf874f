package com.raditha.unnest.model;

/**
 * Flattening transformations the engine can apply.
 */
public enum RefactoringPattern {
    GUARD_CLAUSE("guard-clause", 0.9),
    EARLY_RETURN("early-return", 0.75),
    METHOD_EXTRACTION("method-extraction", 0.6);

    private final String tag;
    private final double baseConfidence;

    RefactoringPattern(String tag, double baseConfidence) {
        this.tag = tag;
        this.baseConfidence = baseConfidence;
    }

    public String tag() {
        return tag;
    }

    public double baseConfidence() {
        return baseConfidence;
    }

    /**
     * Only method extraction may add declarations outside the region.
     */
    public boolean addsDeclarations() {
        return this == METHOD_EXTRACTION;
    }
}
