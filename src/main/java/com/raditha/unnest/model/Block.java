package com.raditha.unnest.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A structural node produced by a dialect adapter.
 * <p>
 * Compound blocks own their statements through {@link BlockKind#BODY} children. A
 * conditional lists the same body blocks in {@link #branches()}, in source order. The
 * unit root is a body at depth 0.
 *
 * @param kind     structural category
 * @param depth    number of enclosing compound blocks
 * @param span     source range
 * @param header   header source text for compound blocks, full text for statements
 * @param children ordered child blocks
 * @param branches branch list, empty unless the block is a conditional
 */
public record Block(
        BlockKind kind,
        int depth,
        Span span,
        String header,
        List<Block> children,
        List<Branch> branches) {

    public Block {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0");
        }
        children = List.copyOf(children);
        branches = List.copyOf(branches);
        header = header == null ? "" : header;
    }

    public boolean isConditional() {
        return kind == BlockKind.CONDITIONAL;
    }

    public boolean hasTrailingElse() {
        return !branches.isEmpty() && branches.get(branches.size() - 1).isElse();
    }

    /**
     * The single body of a non-conditional compound block, or null.
     */
    public Block body() {
        for (Block child : children) {
            if (child.kind() == BlockKind.BODY) {
                return child;
            }
        }
        return null;
    }

    /**
     * This block and every descendant, depth first, in source order.
     */
    public Stream<Block> walk() {
        List<Block> out = new ArrayList<>();
        collect(this, out);
        return out.stream();
    }

    private static void collect(Block block, List<Block> out) {
        out.add(block);
        for (Block child : block.children()) {
            collect(child, out);
        }
    }

    @Override
    public String toString() {
        return kind + "@" + span.toDisplayString() + "(depth " + depth + ")";
    }
}
