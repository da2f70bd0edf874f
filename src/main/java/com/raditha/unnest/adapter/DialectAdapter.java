package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Dialect;

/**
 * Structural indexing strategy for one dialect.
 * <p>
 * Every implementation returns a tree with the same field contract: the root is a
 * {@link com.raditha.unnest.model.BlockKind#BODY} covering the whole text, compound blocks
 * own body children, and conditionals list their branches in source order.
 */
public interface DialectAdapter {

    Dialect dialect();

    /**
     * Build the block tree of a unit.
     *
     * @param text the unit text
     * @return root block at depth 0
     * @throws MalformedStructureException when no consistent tree can be built
     */
    Block index(String text) throws MalformedStructureException;
}
