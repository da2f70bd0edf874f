package com.raditha.unnest.refactoring;

import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splices rewritten text into a copy of the unit text. The source unit itself is never changed.
 */
public final class TransformEngine {

    private TransformEngine() {
    }

    /**
     * Replace a span and insert subroutine declarations.
     * Insertions at or before the span start go before the replacement, the others after it.
     *
     * @param original     unit text the span refers to
     * @param replacedSpan span to replace
     * @param rewritten    replacement text
     * @param subroutines  declarations to insert, applied in list order at equal offsets
     * @return the new unit text
     */
    public static String splice(String original, Span replacedSpan, String rewritten,
            List<ExtractedSubroutine> subroutines) {
        List<ExtractedSubroutine> ordered = new ArrayList<>(subroutines);
        ordered.sort(Comparator.comparingInt(ExtractedSubroutine::insertionOffset));

        StringBuilder out = new StringBuilder(original.length() + rewritten.length());
        int cursor = 0;
        boolean replaced = false;
        for (ExtractedSubroutine sub : ordered) {
            int at = sub.insertionOffset();
            if (at > replacedSpan.start() && !replaced) {
                out.append(original, cursor, replacedSpan.start()).append(rewritten);
                cursor = replacedSpan.end();
                replaced = true;
            }
            if (at < cursor) {
                throw new IllegalArgumentException("Insertion at " + at + " falls inside the replaced span");
            }
            out.append(original, cursor, at).append(sub.text());
            cursor = at;
        }
        if (!replaced) {
            out.append(original, cursor, replacedSpan.start()).append(rewritten);
            cursor = replacedSpan.end();
        }
        out.append(original, cursor, original.length());
        return out.toString();
    }
}
