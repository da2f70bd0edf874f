package com.raditha.unnest.refactoring;

import com.raditha.unnest.analysis.ChainLevel;
import com.raditha.unnest.analysis.FallThroughExit;
import com.raditha.unnest.analysis.ScopeAnalyzer;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.Span;
import com.raditha.unnest.syntax.CodeEmitter;
import com.raditha.unnest.syntax.TextBlocks;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared plumbing for the patterns that move branch bodies between nesting levels.
 */
public abstract class AbstractFlatteningTransformer implements RegionTransformer {

    /**
     * State of one rewrite in progress.
     */
    protected static final class Rewrite {
        private final RegionContext context;
        private final CodeEmitter out;
        private Block absorbed;

        protected Rewrite(RegionContext context) {
            this.context = context;
            this.out = context.emitter();
        }

        protected CodeEmitter out() {
            return out;
        }

        protected RegionContext context() {
            return context;
        }
    }

    @Override
    public int maxRevertedLevels(RegionContext context) {
        return context.chain().length() - 1;
    }

    /**
     * Statements of a continuation branch before the nested conditional.
     */
    protected static TextBlocks.Segment prefixSegment(RegionContext context, ChainLevel level) {
        return context.segment(level.continuationBody().span().start(), level.continuation().span().start());
    }

    /**
     * Statements of a continuation branch after the nested conditional, with trailing comments.
     */
    protected static TextBlocks.Segment postfixSegment(RegionContext context, ChainLevel level) {
        return context.segment(level.continuation().span().end(), level.continuationBody().span().end());
    }

    protected static CodeEmitter.Arm arm(Rewrite rewrite, Branch branch) {
        CodeEmitter.BodyWriter body = level -> rewrite.out.segment(level, rewrite.context.segment(branch.body()));
        return branch.isElse() ? CodeEmitter.Arm.otherwise(body) : CodeEmitter.Arm.when(branch.condition(), body);
    }

    protected static List<CodeEmitter.Arm> arms(Rewrite rewrite, List<Branch> branches) {
        return branches.stream().map(b -> arm(rewrite, b)).toList();
    }

    /**
     * Where a chain level falls through to, failing when it cannot be written out.
     */
    protected static FallThroughExit resolveExit(RegionContext context, int level) throws TransformInfeasibleException {
        FallThroughExit exit = context.chains().fallThrough(context.chain(), level, context.index());
        if (!exit.isResolved()) {
            throw new TransformInfeasibleException(
                    "control falling out of level " + (level + 1) + " has no statement to continue with");
        }
        return exit;
    }

    /**
     * Write a fall-through exit. Inline exits are the last statements of the rewrite, where an
     * implicit return or continue needs no statement.
     */
    protected static void writeExit(Rewrite rewrite, int level, FallThroughExit exit, boolean inline) {
        RegionContext context = rewrite.context;
        switch (exit.kind()) {
            case POSTFIX -> rewrite.out.segment(level, postfixSegment(context, context.chain().level(exit.postfixLevel())));
            case FOLLOWING_STATEMENT -> {
                rewrite.out.segment(level, context.segment(exit.statement()));
                rewrite.absorbed = exit.statement();
            }
            case IMPLICIT_RETURN -> {
                if (!inline) {
                    rewrite.out.statement(level, "return");
                }
            }
            case IMPLICIT_CONTINUE -> {
                if (!inline) {
                    rewrite.out.statement(level, "continue");
                }
            }
            case UNRESOLVED -> throw new IllegalStateException("Unresolved exit reached the emitter");
        }
    }

    /**
     * Package a finished rewrite. A trailing statement copied into the rewrite as an exit is
     * replaced along with the region.
     */
    protected RefactoringCandidate candidate(Rewrite rewrite, int revertedLevels) {
        return candidate(rewrite.context, replacedSpan(rewrite.context, rewrite.absorbed), rewrite.out.text(),
                List.of(), revertedLevels);
    }

    protected RefactoringCandidate candidate(RegionContext context, Span replaced, String rewritten,
            List<ExtractedSubroutine> subroutines, int revertedLevels) {
        String fullText = TransformEngine.splice(context.text(), replaced, rewritten, subroutines);
        return new RefactoringCandidate(pattern(), replaced, rewritten, subroutines, fullText, revertedLevels);
    }

    private static Span replacedSpan(RegionContext context, Block absorbed) {
        Span region = context.region().span();
        if (absorbed == null) {
            return region;
        }
        return new Span(region.start(), absorbed.span().end(), region.startLine(), absorbed.span().endLine());
    }

    /**
     * Names declared by statements that are lifted into the region's own scope and declared
     * again somewhere else in the region or after it. Lifting would put both declarations in
     * one scope.
     */
    protected static Optional<String> scopeConflict(RegionContext context, Collection<Block> lifted) {
        if (context.dialect() == Dialect.PYTHON) {
            return Optional.empty();
        }
        ScopeAnalyzer scope = new ScopeAnalyzer(context.dialect());
        List<String> liftedNames = new ArrayList<>();
        lifted.stream()
                .filter(b -> b.kind() == BlockKind.STATEMENT)
                .forEach(b -> scope.declarations(b.header()).forEach(v -> liftedNames.add(v.name())));
        if (liftedNames.isEmpty()) {
            return Optional.empty();
        }

        List<String> visible = new ArrayList<>();
        declaredNames(scope, context.root(), visible);
        Optional<Block> next = context.index().nextSibling(context.root());
        while (next.isPresent()) {
            declaredNames(scope, next.get(), visible);
            next = context.index().nextSibling(next.get());
        }
        Map<String, Integer> counts = new HashMap<>();
        visible.forEach(name -> counts.merge(name, 1, Integer::sum));
        for (String name : liftedNames) {
            if (counts.getOrDefault(name, 0) > 1) {
                return Optional.of("lifting would declare '" + name + "' twice in one scope");
            }
        }
        return Optional.empty();
    }

    private static void declaredNames(ScopeAnalyzer scope, Block block, List<String> names) {
        block.walk().forEach(b -> {
            if (b.kind() == BlockKind.STATEMENT) {
                scope.declarations(b.header()).forEach(v -> names.add(v.name()));
            } else if (b.kind() == BlockKind.LOOP) {
                scope.loopDeclarations(b.header()).forEach(v -> names.add(v.name()));
            }
        });
    }
}
