package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the spine of a nesting chain and resolves where each level falls through to.
 */
public class ChainAnalyzer {

    private final Dialect dialect;
    private final TerminalAnalyzer terminals;

    public ChainAnalyzer(Dialect dialect) {
        this.dialect = dialect;
        this.terminals = new TerminalAnalyzer(dialect);
    }

    /**
     * Follow the deepest nested conditional from a root conditional down to the innermost
     * level. On equal depth the first conditional in source order wins.
     */
    public NestingChain spine(Block root) {
        if (!root.isConditional()) {
            throw new IllegalArgumentException("Chain root must be a conditional: " + root);
        }
        List<ChainLevel> levels = new ArrayList<>();
        Block current = root;
        while (current != null) {
            Block best = null;
            int bestBranch = -1;
            int bestDepth = 0;
            List<Branch> branches = current.branches();
            for (int i = 0; i < branches.size(); i++) {
                for (Block statement : branches.get(i).body().children()) {
                    if (statement.isConditional()) {
                        int depth = ChainMeasure.depthBelow(statement);
                        if (depth > bestDepth) {
                            best = statement;
                            bestBranch = i;
                            bestDepth = depth;
                        }
                    }
                }
            }
            if (best == null) {
                levels.add(new ChainLevel(current, -1, null, List.of(), List.of()));
            } else {
                List<Block> statements = branches.get(bestBranch).body().children();
                int at = indexOf(statements, best);
                levels.add(new ChainLevel(current, bestBranch, best, statements.subList(0, at),
                        statements.subList(at + 1, statements.size())));
            }
            current = best;
        }
        return new NestingChain(levels);
    }

    private static int indexOf(List<Block> statements, Block block) {
        for (int i = 0; i < statements.size(); i++) {
            if (statements.get(i) == block) {
                return i;
            }
        }
        throw new IllegalStateException("Continuation not found in its branch body");
    }

    /**
     * Where control continues when the conditional at a spine level completes normally:
     * the nearest enclosing non-empty postfix, then what follows the region.
     */
    public FallThroughExit fallThrough(NestingChain chain, int level, BlockIndex index) {
        for (int j = level - 1; j >= 0; j--) {
            if (!chain.level(j).postfix().isEmpty()) {
                return FallThroughExit.postfix(j);
            }
        }
        return afterRegion(chain.root(), index);
    }

    /**
     * Exit reached by falling off the end of the region root.
     */
    public FallThroughExit afterRegion(Block root, BlockIndex index) {
        Optional<Block> next = index.nextSibling(root);
        if (next.isPresent()) {
            Block statement = next.get();
            return statement.kind() == BlockKind.STATEMENT && terminals.isTerminal(statement)
                    ? FallThroughExit.following(statement)
                    : FallThroughExit.unresolved();
        }
        Optional<Block> body = index.containingBody(root);
        Optional<Block> owner = body.flatMap(index::ownerOf);
        if (owner.isEmpty() || owner.get().body() != body.get()) {
            return FallThroughExit.unresolved();
        }
        Block block = owner.get();
        if (block.kind() == BlockKind.FUNCTION
                && FunctionHeader.parse(dialect, block.header()).returnsNothing(dialect)) {
            return FallThroughExit.implicitReturn();
        }
        if (block.kind() == BlockKind.LOOP) {
            return FallThroughExit.implicitContinue();
        }
        return FallThroughExit.unresolved();
    }

    public TerminalAnalyzer terminals() {
        return terminals;
    }
}
