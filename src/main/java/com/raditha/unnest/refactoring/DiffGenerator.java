package com.raditha.unnest.refactoring;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.unnest.model.RefactoringReport;

import java.util.Arrays;
import java.util.List;

/**
 * Generates unified diffs for refactoring previews.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Unified diff of a report's original text against its rewritten text, empty when the
     * unit was not modified.
     */
    public String generateUnifiedDiff(RefactoringReport report) {
        return generateUnifiedDiff(report, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(RefactoringReport report, int contextLines) {
        if (!report.isModified()) {
            return "";
        }
        return generateUnifiedDiff(report.source().identity(), report.source().text(), report.rewrittenText(),
                contextLines);
    }

    /**
     * Generate a unified diff between two versions of a text.
     *
     * @param name         name shown in the diff headers
     * @param original     text before
     * @param revised      text after
     * @param contextLines unchanged lines shown around each change
     */
    public String generateUnifiedDiff(String name, String original, String revised, int contextLines) {
        List<String> originalLines = lines(original);
        List<String> revisedLines = lines(revised);

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + name,
                "b/" + name,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }

    private static List<String> lines(String text) {
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
