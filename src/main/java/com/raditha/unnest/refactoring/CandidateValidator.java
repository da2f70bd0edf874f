package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.DialectAdapter;
import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Checks a candidate by re-indexing the rewritten unit text.
 */
public class CandidateValidator {

    private final DialectAdapter adapter;

    public CandidateValidator(DialectAdapter adapter) {
        this.adapter = adapter;
    }

    /**
     * Validate a candidate against the region it replaces.
     *
     * @param candidate      the candidate
     * @param depthBefore    depth of the region before the rewrite
     * @param depthThreshold configured detection threshold
     */
    public ValidationResult validate(RefactoringCandidate candidate, int depthBefore, int depthThreshold) {
        // 1. the whole text must still index
        Block reindexed;
        try {
            reindexed = adapter.index(candidate.fullText());
        } catch (MalformedStructureException e) {
            return ValidationResult.malformed(e.getMessage());
        }

        // 2. the rewrite must be shallower than before, and than the threshold
        List<Block> roots = ChainMeasure.chainRootsStartingIn(reindexed, candidate.rewrittenStart(),
                candidate.rewrittenEnd());
        int depthAfter = roots.stream().mapToInt(ChainMeasure::depthBelow).max().orElse(0);
        if (depthAfter >= depthBefore || depthAfter >= depthThreshold) {
            return ValidationResult.depthNotReduced(
                    "depth not reduced: " + depthBefore + " -> " + depthAfter + " (threshold " + depthThreshold + ")",
                    depthAfter, reindexed);
        }

        // 3. every extracted subroutine is declared, called, and below the threshold itself
        for (ExtractedSubroutine sub : candidate.subroutines()) {
            String call = sub.name() + "(";
            Optional<Block> declared = reindexed.walk()
                    .filter(b -> b.kind() == BlockKind.FUNCTION && b.header().contains(call))
                    .findFirst();
            if (declared.isEmpty()) {
                return ValidationResult.roundTripFailed("subroutine " + sub.name() + " is not declared",
                        depthAfter, reindexed);
            }
            if (!candidate.rewrittenText().contains(call)) {
                return ValidationResult.roundTripFailed("subroutine " + sub.name() + " is never called",
                        depthAfter, reindexed);
            }
            int kept = ChainMeasure.deepestChainIn(declared.get().body());
            if (kept >= depthThreshold) {
                return ValidationResult.depthNotReduced("depth not reduced: subroutine " + sub.name()
                        + " keeps a chain of depth " + kept + " (threshold " + depthThreshold + ")",
                        depthAfter, reindexed);
            }
        }
        return ValidationResult.accepted(depthAfter, reindexed);
    }
}
