package com.raditha.unnest.metrics;

import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.MetricsSnapshot;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;

import java.util.List;

/**
 * Compares a region before and after its rewrite and scores the rewrite.
 */
public class MetricsComparator {

    private static final double DEPTH_WEIGHT = 0.5;
    private static final double PATTERN_WEIGHT = 0.5;
    private static final double REPAIR_PENALTY = 0.1;
    private static final double MIN_CONFIDENCE = 0.1;

    /**
     * Measure an accepted candidate.
     *
     * @param region    the region as detected
     * @param candidate the accepted candidate
     * @param reindexed block tree of the candidate's full text
     * @param repairs   repair attempts the candidate consumed
     */
    public MetricsSnapshot compare(ConditionalRegion region, RefactoringCandidate candidate, Block reindexed,
            int repairs) {
        List<Block> roots = ChainMeasure.chainRootsStartingIn(reindexed, candidate.rewrittenStart(),
                candidate.rewrittenEnd());
        int depthAfter = roots.stream().mapToInt(ChainMeasure::depthBelow).max().orElse(0);
        int branchesAfter = roots.stream().mapToInt(ChainMeasure::branchCount).sum();
        int depthBefore = region.maxDepth();
        return new MetricsSnapshot(
                depthBefore,
                depthAfter,
                region.fingerprint().branchCount(),
                branchesAfter,
                confidence(candidate.pattern(), depthBefore, depthAfter, repairs));
    }

    /**
     * Weighted depth reduction and pattern reliability, less a penalty per repair.
     *
     * @return score between 0.1 and 1.0, rounded to three decimals
     */
    public static double confidence(RefactoringPattern pattern, int depthBefore, int depthAfter, int repairs) {
        double reduction = depthBefore <= 0 ? 0.0 : (double) (depthBefore - depthAfter) / depthBefore;
        double score = DEPTH_WEIGHT * reduction
                + PATTERN_WEIGHT * pattern.baseConfidence()
                - REPAIR_PENALTY * repairs;
        score = Math.max(MIN_CONFIDENCE, Math.min(1.0, score));
        return Math.round(score * 1000.0) / 1000.0;
    }
}
