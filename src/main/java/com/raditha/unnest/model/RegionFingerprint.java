package com.raditha.unnest.model;

/**
 * Structural fingerprint of a conditional region.
 * Identifier names and literals do not take part, so cosmetic edits keep the fingerprint.
 *
 * @param depth           maximum nesting depth of the chain
 * @param branchCount     number of branches across every conditional in the chain
 * @param trailingElse    whether the root conditional ends in an unconditional else
 * @param earlyExit       whether any branch contains a return, throw, break or continue
 * @param terminalPattern one character per root branch: 'T' when the branch ends in a
 *                        terminal statement, 'F' when it falls through
 */
public record RegionFingerprint(
        int depth,
        int branchCount,
        boolean trailingElse,
        boolean earlyExit,
        String terminalPattern) {

    /**
     * Stable hash usable as a cache key by suggestion providers.
     */
    public String structuralHash() {
        return String.format("d%d-b%d-%s%s-%s",
                depth,
                branchCount,
                trailingElse ? "E" : "e",
                earlyExit ? "X" : "x",
                terminalPattern);
    }
}
