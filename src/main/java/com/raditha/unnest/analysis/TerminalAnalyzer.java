package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.Dialect;

import java.util.List;
import java.util.Set;

/**
 * Decides which statements end control flow in their body.
 */
public class TerminalAnalyzer {

    private static final Set<String> TERMINAL_WORDS = Set.of("return", "throw", "break", "continue");
    private static final Set<String> PYTHON_TERMINAL_WORDS = Set.of("return", "raise", "break", "continue");

    private final Set<String> terminalWords;

    public TerminalAnalyzer(Dialect dialect) {
        this.terminalWords = dialect == Dialect.PYTHON || dialect == Dialect.GENERIC
                ? PYTHON_TERMINAL_WORDS
                : TERMINAL_WORDS;
    }

    /**
     * Whether control never continues past a block: a return, throw, break or continue
     * statement, a conditional whose branches all end that way and that has an else, or a
     * plain scope block that ends that way.
     */
    public boolean isTerminal(Block block) {
        return switch (block.kind()) {
            case STATEMENT -> terminalWords.contains(leadingWord(block.header()));
            case CONDITIONAL -> block.hasTrailingElse()
                    && block.branches().stream().map(Branch::body).allMatch(this::endsTerminal);
            case OTHER -> block.header().isEmpty() && block.body() != null && endsTerminal(block.body());
            case BODY -> endsTerminal(block);
            default -> false;
        };
    }

    /**
     * Whether the last statement of a body is terminal.
     */
    public boolean endsTerminal(Block body) {
        List<Block> children = body.children();
        return !children.isEmpty() && isTerminal(children.get(children.size() - 1));
    }

    /**
     * Whether a block contains an early exit statement anywhere, ignoring nested functions.
     */
    public boolean containsExit(Block block) {
        return containsStatement(block, terminalWords);
    }

    /**
     * Whether a block contains a return statement, ignoring nested functions.
     */
    public boolean containsReturn(Block block) {
        return containsStatement(block, Set.of("return"));
    }

    private boolean containsStatement(Block block, Set<String> words) {
        if (block.kind() == BlockKind.STATEMENT && words.contains(leadingWord(block.header()))) {
            return true;
        }
        for (Block child : block.children()) {
            if (child.kind() != BlockKind.FUNCTION && child.kind() != BlockKind.TYPE
                    && containsStatement(child, words)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Leading identifier of a statement text, or an empty string.
     */
    public static String leadingWord(String text) {
        String stripped = text.stripLeading();
        int end = 0;
        while (end < stripped.length() && Character.isJavaIdentifierPart(stripped.charAt(end))) {
            end++;
        }
        return stripped.substring(0, end);
    }
}
