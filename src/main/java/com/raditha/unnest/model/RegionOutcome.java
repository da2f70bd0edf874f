package com.raditha.unnest.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-region entry of a refactoring report.
 *
 * @param region          the region, null only when the whole unit failed to index
 * @param pattern         pattern selected for the region, null when none was selected
 * @param applied         whether the rewrite is part of the report's rewritten text
 * @param metrics         before/after metrics, null when no candidate was validated
 * @param confidence      confidence score, null when not computed
 * @param flags           review flags
 * @param error           failure category, null on success
 * @param message         human readable detail for failures and flags
 * @param repairAttempts  repair attempts consumed
 * @param proposedRewrite candidate text kept for review when it was not applied
 */
public record RegionOutcome(
        ConditionalRegion region,
        RefactoringPattern pattern,
        boolean applied,
        MetricsSnapshot metrics,
        Double confidence,
        Set<OutcomeFlag> flags,
        ErrorKind error,
        String message,
        int repairAttempts,
        String proposedRewrite) {

    public static final String NOT_REFACTORED = "not-refactored";

    public RegionOutcome {
        flags = flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
    }

    public static RegionOutcome applied(ConditionalRegion region, RefactoringPattern pattern,
            MetricsSnapshot metrics, Set<OutcomeFlag> flags, int repairAttempts) {
        return new RegionOutcome(region, pattern, true, metrics, metrics.confidence(), flags, null, null,
                repairAttempts, null);
    }

    public static RegionOutcome lowConfidence(ConditionalRegion region, RefactoringPattern pattern,
            MetricsSnapshot metrics, Set<OutcomeFlag> flags, int repairAttempts, String proposedRewrite) {
        Set<OutcomeFlag> all = EnumSet.of(OutcomeFlag.LOW_CONFIDENCE);
        all.addAll(flags);
        return new RegionOutcome(region, pattern, false, metrics, metrics.confidence(), all,
                null, "Confidence below acceptance threshold", repairAttempts, proposedRewrite);
    }

    public static RegionOutcome failed(ConditionalRegion region, RefactoringPattern pattern, ErrorKind error,
            String message, int repairAttempts) {
        return new RegionOutcome(region, pattern, false, null, null, Set.of(), error, message, repairAttempts,
                null);
    }

    public static RegionOutcome skipped(ConditionalRegion region, OutcomeFlag flag, String message) {
        return new RegionOutcome(region, null, false, null, null, Set.of(flag), null, message, 0, null);
    }

    /**
     * Pattern tag when the rewrite was applied, otherwise {@value #NOT_REFACTORED}.
     */
    public String patternLabel() {
        return applied && pattern != null ? pattern.tag() : NOT_REFACTORED;
    }

    public boolean hasFlag(OutcomeFlag flag) {
        return flags.contains(flag);
    }
}
