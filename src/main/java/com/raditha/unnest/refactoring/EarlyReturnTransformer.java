package com.raditha.unnest.refactoring;

import com.raditha.unnest.analysis.ChainLevel;
import com.raditha.unnest.analysis.ConditionAnalyzer;
import com.raditha.unnest.analysis.NestingChain;
import com.raditha.unnest.analysis.TerminalAnalyzer;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.syntax.CodeEmitter;

import java.util.List;
import java.util.Optional;

/**
 * Turns an if / else-if ladder written as nested else branches into a flat run of
 * conditionals, each ending in its own exit, followed by the final else body.
 * <p>
 * Every conditioned branch must end in a terminal statement and all conditions must test the
 * same subject, so the ladder reads as a sequence of range or case checks.
 */
public class EarlyReturnTransformer extends AbstractFlatteningTransformer {

    @Override
    public RefactoringPattern pattern() {
        return RefactoringPattern.EARLY_RETURN;
    }

    @Override
    public Optional<String> ineligibility(RegionContext context) {
        NestingChain chain = context.chain();
        TerminalAnalyzer terminals = context.chains().terminals();
        ConditionAnalyzer conditions = new ConditionAnalyzer(context.dialect());
        String subject = null;

        for (int i = 0; i < chain.length(); i++) {
            ChainLevel level = chain.level(i);
            if (!level.isInnermost()) {
                boolean lastBranch = level.continuationBranch() == level.branches().size() - 1;
                if (level.continuesThroughCondition() || !lastBranch) {
                    return Optional.of("level " + (i + 1) + " does not continue through its final else");
                }
                if (!level.prefix().isEmpty() || !level.postfix().isEmpty()) {
                    return Optional.of("the else at level " + (i + 1) + " holds more than the nested conditional");
                }
            }
            for (Branch branch : level.branches()) {
                if (branch.isElse()) {
                    continue;
                }
                if (!terminals.endsTerminal(branch.body())) {
                    return Optional.of("a conditioned branch at level " + (i + 1) + " falls through");
                }
                String tested = conditions.subject(branch.condition());
                if (tested.isEmpty() || (subject != null && !subject.equals(tested))) {
                    return Optional.of("conditions test different subjects");
                }
                subject = tested;
            }
        }

        ChainLevel innermost = chain.innermost();
        if (innermost.conditional().hasTrailingElse()) {
            List<Branch> branches = innermost.branches();
            return scopeConflict(context, branches.get(branches.size() - 1).body().children());
        }
        return Optional.empty();
    }

    @Override
    public RefactoringCandidate transform(RegionContext context, int revertedLevels)
            throws TransformInfeasibleException {
        NestingChain chain = context.chain();
        int kept = chain.length() - revertedLevels;
        if (revertedLevels < 0 || kept < 1) {
            throw new TransformInfeasibleException("cannot keep " + revertedLevels + " of " + chain.length()
                    + " levels");
        }
        Rewrite rewrite = new Rewrite(context);
        CodeEmitter out = rewrite.out();

        for (int i = 0; i < kept; i++) {
            ChainLevel level = chain.level(i);
            for (Branch branch : level.branches()) {
                if (!branch.isElse()) {
                    out.conditional(0, List.of(arm(rewrite, branch)));
                }
            }
            if (i < kept - 1) {
                continue;
            }
            if (level.isInnermost()) {
                if (level.conditional().hasTrailingElse()) {
                    List<Branch> branches = level.branches();
                    out.segment(0, context.segment(branches.get(branches.size() - 1).body()));
                }
            } else {
                Block continuation = level.continuation();
                out.segment(0, context.segment(continuation));
            }
        }
        return candidate(rewrite, revertedLevels);
    }
}
