package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable node used by the adapters while the tree is being discovered.
 * Depths are assigned once, when the finished tree is converted to {@link Block} records.
 */
final class BlockBuilder {

    final BlockKind kind;
    int start;
    int end;
    String header;
    final List<BlockBuilder> children = new ArrayList<>();
    private final List<String> conditions = new ArrayList<>();

    BlockBuilder(BlockKind kind, int start, int end, String header) {
        this.kind = kind;
        this.start = start;
        this.end = end;
        this.header = header;
    }

    static BlockBuilder body(int start, int end) {
        return new BlockBuilder(BlockKind.BODY, start, end, "");
    }

    BlockBuilder add(BlockBuilder child) {
        children.add(child);
        return this;
    }

    /**
     * Add a branch to a conditional. A null condition marks the unconditional else.
     */
    BlockBuilder addBranch(String condition, BlockBuilder body) {
        children.add(body);
        conditions.add(condition);
        return this;
    }

    /**
     * Convert the tree rooted here, which must be the unit root, into records.
     */
    Block build(LineIndex lines) {
        return build(lines, 0);
    }

    private Block build(LineIndex lines, int depth) {
        // bodies sit one level below their owner, everything else at the depth of the enclosing body
        int childDepth = kind.isCompound() ? depth + 1 : depth;
        List<Block> built = new ArrayList<>(children.size());
        for (BlockBuilder child : children) {
            built.add(child.build(lines, childDepth));
        }
        List<Branch> branches = new ArrayList<>();
        if (kind == BlockKind.CONDITIONAL) {
            for (int i = 0; i < conditions.size(); i++) {
                branches.add(new Branch(conditions.get(i), built.get(i)));
            }
        }
        return new Block(kind, depth, lines.span(start, end), header, built, branches);
    }
}
