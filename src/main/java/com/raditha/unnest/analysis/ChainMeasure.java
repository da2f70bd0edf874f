package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;

import java.util.ArrayList;
import java.util.List;

/**
 * Measurements of conditional chains.
 * <p>
 * A chain continues from a conditional into the conditionals that are direct statements
 * of its branch bodies. Any other block in between (a loop, a function, a try or a plain
 * scope) ends the chain.
 */
public final class ChainMeasure {

    private ChainMeasure() {
    }

    /**
     * Conditionals that continue the chain directly below a conditional, in source order.
     */
    public static List<Block> nestedConditionals(Block conditional) {
        List<Block> nested = new ArrayList<>();
        for (Branch branch : conditional.branches()) {
            for (Block statement : branch.body().children()) {
                if (statement.isConditional()) {
                    nested.add(statement);
                }
            }
        }
        return nested;
    }

    /**
     * Number of chain levels from a conditional down to its deepest chained conditional,
     * counting the conditional itself.
     */
    public static int depthBelow(Block conditional) {
        int deepest = 0;
        for (Block nested : nestedConditionals(conditional)) {
            deepest = Math.max(deepest, depthBelow(nested));
        }
        return deepest + 1;
    }

    /**
     * Deepest chain that starts among the direct statements of a body, 0 when it has none.
     */
    public static int deepestChainIn(Block body) {
        if (body == null) {
            return 0;
        }
        return body.children().stream()
                .filter(Block::isConditional)
                .mapToInt(ChainMeasure::depthBelow)
                .max()
                .orElse(0);
    }

    /**
     * Branches of every conditional in the chain rooted at a conditional.
     */
    public static int branchCount(Block conditional) {
        int count = conditional.branches().size();
        for (Block nested : nestedConditionals(conditional)) {
            count += branchCount(nested);
        }
        return count;
    }

    /**
     * The conditional and every conditional chained below it, in source order.
     */
    public static List<Block> members(Block conditional) {
        List<Block> members = new ArrayList<>();
        collect(conditional, members);
        return members;
    }

    private static void collect(Block conditional, List<Block> members) {
        members.add(conditional);
        for (Block nested : nestedConditionals(conditional)) {
            collect(nested, members);
        }
    }

    /**
     * Conditionals of a tree that start a chain: those whose containing body is not a
     * branch body. Ordered by start offset.
     */
    public static List<Block> chainRoots(Block root, BlockIndex index) {
        return root.walk()
                .filter(Block::isConditional)
                .filter(block -> index.containingBody(block).map(body -> !index.isBranchBody(body)).orElse(true))
                .toList();
    }

    /**
     * Chain roots of a tree that start in {@code [start, end)}.
     */
    public static List<Block> chainRootsStartingIn(Block root, int start, int end) {
        return chainRoots(root, new BlockIndex(root)).stream()
                .filter(b -> b.span().start() >= start && b.span().start() < end)
                .toList();
    }
}
