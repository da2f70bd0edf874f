package com.raditha.unnest.refactoring;

import com.raditha.unnest.analysis.ChainLevel;
import com.raditha.unnest.analysis.FallThroughExit;
import com.raditha.unnest.analysis.NestingChain;
import com.raditha.unnest.analysis.TerminalAnalyzer;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.syntax.CodeEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Inverts the conditions that lead into a nested conditional and exits early when they fail,
 * so the code that used to be nested runs at the region's own level.
 * <p>
 * Applies when every branch that does not lead deeper ends in a terminal statement, and
 * control that falls out of a level can be written out as an explicit exit.
 */
public class GuardClauseTransformer extends AbstractFlatteningTransformer {

    @Override
    public RefactoringPattern pattern() {
        return RefactoringPattern.GUARD_CLAUSE;
    }

    @Override
    public Optional<String> ineligibility(RegionContext context) {
        NestingChain chain = context.chain();
        TerminalAnalyzer terminals = context.chains().terminals();
        if (chain.levels().stream().noneMatch(ChainLevel::continuesThroughCondition)) {
            return Optional.of("the chain only continues through else branches");
        }

        List<Block> lifted = new ArrayList<>();
        for (int i = 0; i < chain.length(); i++) {
            ChainLevel level = chain.level(i);
            List<Branch> branches = level.branches();
            int shown = i + 1;
            if (level.isInnermost()) {
                if (!branches.stream().allMatch(b -> terminals.endsTerminal(b.body()))) {
                    return Optional.of("an innermost branch falls through");
                }
                if (!level.conditional().hasTrailingElse() && !resolves(context, i)) {
                    return Optional.of("no exit for the innermost conditional");
                }
                continue;
            }

            int k = level.continuationBranch();
            int after = branches.size() - k - 1;
            if (level.continuesThroughCondition() && (after > 1 || (after == 1 && !branches.get(k + 1).isElse()))) {
                return Optional.of("a conditioned branch follows the nested conditional at level " + shown);
            }
            for (int b = 0; b < branches.size(); b++) {
                if (b != k && !terminals.endsTerminal(branches.get(b).body())) {
                    return Optional.of("a branch at level " + shown + " falls through");
                }
            }
            List<Block> postfix = level.postfix();
            if (!postfix.isEmpty() && !terminals.isTerminal(postfix.get(postfix.size() - 1))) {
                return Optional.of("statements after the nested conditional at level " + shown + " fall through");
            }
            if (level.continuesThroughCondition() && after == 0 && !resolves(context, i)) {
                return Optional.of("no exit for the guard at level " + shown);
            }
            lifted.addAll(level.prefix());
        }
        return scopeConflict(context, lifted);
    }

    private static boolean resolves(RegionContext context, int level) {
        return context.chains().fallThrough(context.chain(), level, context.index()).isResolved();
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
            if (level.isInnermost()) {
                writeInnermost(rewrite, i);
                break;
            }
            List<Branch> branches = level.branches();
            int k = level.continuationBranch();

            // 1. branches ahead of the continuation keep their conditions
            if (k > 0) {
                out.conditional(0, arms(rewrite, branches.subList(0, k)));
            }

            // 2. the continuation's own condition becomes a guard
            if (level.continuesThroughCondition()) {
                String guard = context.style().negate(branches.get(k).condition());
                if (k + 1 < branches.size()) {
                    Branch otherwise = branches.get(k + 1);
                    out.conditional(0, List.of(CodeEmitter.Arm.when(guard,
                            l -> out.segment(l, context.segment(otherwise.body())))));
                } else {
                    FallThroughExit exit = resolveExit(context, i);
                    out.conditional(0, List.of(CodeEmitter.Arm.when(guard, l -> writeExit(rewrite, l, exit, false))));
                }
            }

            // 3. statements ahead of the nested conditional move up one level
            out.segment(0, prefixSegment(context, level));

            // 4. reverted levels stay as they were
            if (i == kept - 1) {
                out.segment(0, context.segment(level.continuation()));
                out.segment(0, postfixSegment(context, level));
                if (level.postfix().isEmpty() && !context.chains().terminals().isTerminal(level.continuation())) {
                    writeExit(rewrite, 0, resolveExit(context, i + 1), true);
                }
            }
        }
        return candidate(rewrite, revertedLevels);
    }

    private void writeInnermost(Rewrite rewrite, int index) throws TransformInfeasibleException {
        RegionContext context = rewrite.context();
        CodeEmitter out = rewrite.out();
        Block conditional = context.chain().level(index).conditional();
        List<Branch> branches = conditional.branches();
        Branch first = branches.get(0);
        String negated = context.style().negate(first.condition());

        if (branches.size() == 1) {
            FallThroughExit exit = resolveExit(context, index);
            out.conditional(0, List.of(CodeEmitter.Arm.when(negated, l -> writeExit(rewrite, l, exit, false))));
            out.segment(0, context.segment(first.body()));
        } else if (branches.size() == 2 && conditional.hasTrailingElse()) {
            Branch otherwise = branches.get(1);
            out.conditional(0, List.of(CodeEmitter.Arm.when(negated,
                    l -> out.segment(l, context.segment(otherwise.body())))));
            out.segment(0, context.segment(first.body()));
        } else if (conditional.hasTrailingElse()) {
            out.conditional(0, arms(rewrite, branches.subList(0, branches.size() - 1)));
            out.segment(0, context.segment(branches.get(branches.size() - 1).body()));
        } else {
            FallThroughExit exit = resolveExit(context, index);
            out.conditional(0, arms(rewrite, branches));
            writeExit(rewrite, 0, exit, true);
        }
    }
}
