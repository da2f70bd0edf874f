package com.raditha.unnest.refactoring;

import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;

import java.util.Optional;

/**
 * A flattening pattern: decides whether it fits a region and produces the rewrite.
 */
public interface RegionTransformer {

    RefactoringPattern pattern();

    /**
     * Why the pattern cannot be applied to a region, empty when it can.
     */
    Optional<String> ineligibility(RegionContext context);

    /**
     * Rewrite a region.
     *
     * @param context        the region and its unit
     * @param revertedLevels innermost levels, or last branches, to leave in their original form
     * @return the candidate, with the unit's full text already spliced
     * @throws TransformInfeasibleException when the rewrite cannot be produced
     */
    RefactoringCandidate transform(RegionContext context, int revertedLevels) throws TransformInfeasibleException;

    /**
     * Largest value of {@code revertedLevels} that still flattens something.
     */
    int maxRevertedLevels(RegionContext context);
}
