package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;

import java.util.List;

/**
 * The spine of a region: from the root conditional down through the deepest nested
 * conditional at each level.
 *
 * @param levels spine levels, outermost first
 */
public record NestingChain(List<ChainLevel> levels) {

    public NestingChain {
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("A chain has at least one level");
        }
        levels = List.copyOf(levels);
    }

    public Block root() {
        return levels.get(0).conditional();
    }

    public ChainLevel level(int i) {
        return levels.get(i);
    }

    public ChainLevel innermost() {
        return levels.get(levels.size() - 1);
    }

    /**
     * Number of levels, which is the chain depth of the root.
     */
    public int length() {
        return levels.size();
    }
}
