package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;

import java.util.List;

/**
 * One level of a nesting chain's spine.
 *
 * @param conditional        the conditional at this level
 * @param continuationBranch index of the branch holding the next level, -1 at the innermost level
 * @param continuation       the conditional of the next level, null at the innermost level
 * @param prefix             statements of the continuation branch before the continuation
 * @param postfix            statements of the continuation branch after the continuation
 */
public record ChainLevel(
        Block conditional,
        int continuationBranch,
        Block continuation,
        List<Block> prefix,
        List<Block> postfix) {

    public ChainLevel {
        prefix = List.copyOf(prefix);
        postfix = List.copyOf(postfix);
    }

    public boolean isInnermost() {
        return continuation == null;
    }

    public List<Branch> branches() {
        return conditional.branches();
    }

    /**
     * Body of the continuation branch, null at the innermost level.
     */
    public Block continuationBody() {
        return isInnermost() ? null : conditional.branches().get(continuationBranch).body();
    }

    /**
     * Whether the chain continues through a conditioned branch rather than the else.
     */
    public boolean continuesThroughCondition() {
        return !isInnermost() && !conditional.branches().get(continuationBranch).isElse();
    }
}
