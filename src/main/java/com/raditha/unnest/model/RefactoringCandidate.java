package com.raditha.unnest.model;

import java.util.List;

/**
 * A proposed rewrite of one region, not yet validated.
 *
 * @param pattern        pattern that produced it
 * @param replacedSpan   original span being replaced, the region span possibly widened
 *                       by an absorbed trailing exit statement
 * @param rewrittenText  replacement text for {@code replacedSpan}
 * @param subroutines    subroutines introduced by method extraction, empty otherwise
 * @param fullText       whole unit text with the replacement and subroutines spliced in
 * @param revertedLevels nesting levels or branches left in their original form by repairs
 */
public record RefactoringCandidate(
        RefactoringPattern pattern,
        Span replacedSpan,
        String rewrittenText,
        List<ExtractedSubroutine> subroutines,
        String fullText,
        int revertedLevels) {

    public RefactoringCandidate {
        subroutines = List.copyOf(subroutines);
    }

    /**
     * Offset in {@link #fullText()} at which the rewritten span begins.
     * Subroutines inserted before the region shift it to the right.
     */
    public int rewrittenStart() {
        int shift = 0;
        for (ExtractedSubroutine sub : subroutines) {
            if (sub.insertionOffset() <= replacedSpan.start()) {
                shift += sub.text().length();
            }
        }
        return replacedSpan.start() + shift;
    }

    public int rewrittenEnd() {
        return rewrittenStart() + rewrittenText.length();
    }

    /**
     * Copy with a different full text, used by textual repairs.
     */
    public RefactoringCandidate withRepairedText(String repairedRewrite, String repairedFullText) {
        return new RefactoringCandidate(pattern, replacedSpan, repairedRewrite, subroutines, repairedFullText,
                revertedLevels);
    }
}
