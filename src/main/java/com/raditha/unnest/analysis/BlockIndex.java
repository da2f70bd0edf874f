package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parent links for a block tree.
 * Blocks are records with value equality, so the links are keyed by identity.
 */
public class BlockIndex {

    private final Block root;
    private final Map<Block, Block> parents = new IdentityHashMap<>();

    public BlockIndex(Block root) {
        this.root = root;
        link(root);
    }

    private void link(Block block) {
        for (Block child : block.children()) {
            parents.put(child, block);
            link(child);
        }
    }

    public Block root() {
        return root;
    }

    /**
     * Parent of a block, empty for the root.
     */
    public Optional<Block> parentOf(Block block) {
        return Optional.ofNullable(parents.get(block));
    }

    /**
     * Ancestors from the direct parent up to the root.
     */
    public List<Block> ancestors(Block block) {
        List<Block> result = new ArrayList<>();
        Block current = parents.get(block);
        while (current != null) {
            result.add(current);
            current = parents.get(current);
        }
        return result;
    }

    /**
     * Nearest ancestor of a given kind.
     */
    public Optional<Block> enclosing(Block block, BlockKind kind) {
        for (Block ancestor : ancestors(block)) {
            if (ancestor.kind() == kind) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    /**
     * The body that directly contains a block, or empty when the block is itself a body of
     * the root.
     */
    public Optional<Block> containingBody(Block block) {
        return parentOf(block).filter(parent -> parent.kind() == BlockKind.BODY);
    }

    /**
     * Compound block that owns a body, empty for the unit root.
     */
    public Optional<Block> ownerOf(Block body) {
        return parentOf(body);
    }

    /**
     * Statement following a block in its containing body.
     */
    public Optional<Block> nextSibling(Block block) {
        return containingBody(block).flatMap(body -> {
            List<Block> children = body.children();
            for (int i = 0; i < children.size() - 1; i++) {
                if (children.get(i) == block) {
                    return Optional.of(children.get(i + 1));
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Whether a block is the last statement of its containing body.
     */
    public boolean isLastInBody(Block block) {
        return containingBody(block)
                .map(body -> !body.children().isEmpty() && body.children().get(body.children().size() - 1) == block)
                .orElse(false);
    }

    /**
     * Whether a body is one of the branch bodies of a conditional.
     */
    public boolean isBranchBody(Block body) {
        return body.kind() == BlockKind.BODY
                && parentOf(body).map(Block::isConditional).orElse(false);
    }
}
