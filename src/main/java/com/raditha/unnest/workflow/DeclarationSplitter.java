package com.raditha.unnest.workflow;

import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits unit text into top-level declarations without parsing it, for units that do not
 * index as a whole.
 * <p>
 * A declaration starts on a line with no indentation. Lines that begin with a delimiter or a
 * continuation keyword stay with the declaration above them, and a decorator or annotation
 * line starts the declaration it decorates. The parts tile the text: the first starts at
 * offset 0 and each one ends where the next begins.
 */
final class DeclarationSplitter {

    private static final Set<String> CONTINUATIONS = Set.of(
            "else", "elif", "except", "finally", "catch", "while");

    private DeclarationSplitter() {
    }

    /**
     * @return {@code [start, end)} ranges of the top-level declarations, in source order
     */
    static List<int[]> split(String text, Dialect dialect) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        boolean decorated = false;
        int lineStart = 0;
        while (lineStart < text.length()) {
            int lineEnd = text.indexOf('\n', lineStart);
            int next = lineEnd < 0 ? text.length() : lineEnd + 1;
            String line = text.substring(lineStart, lineEnd < 0 ? text.length() : lineEnd);
            if (!line.isBlank()) {
                if (startsDeclaration(line) && !decorated && lineStart > 0) {
                    starts.add(lineStart);
                }
                decorated = line.startsWith("@") || (dialect == Dialect.CSHARP && line.startsWith("["));
            }
            lineStart = next;
        }

        List<int[]> parts = new ArrayList<>();
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
            parts.add(new int[] {starts.get(i), end});
        }
        return parts;
    }

    private static boolean startsDeclaration(String line) {
        char first = line.charAt(0);
        if (Character.isWhitespace(first) || "{}])".indexOf(first) >= 0) {
            return false;
        }
        return !CONTINUATIONS.contains(leadingWord(line));
    }

    private static String leadingWord(String line) {
        int end = 0;
        while (end < line.length() && Character.isJavaIdentifierPart(line.charAt(end))) {
            end++;
        }
        return line.substring(0, end);
    }

    /**
     * The text with everything outside {@code [start, end)} blanked to spaces. Line breaks are
     * kept, so offsets and line numbers stay those of the original text.
     */
    static String isolate(String text, int start, int end) {
        StringBuilder isolated = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean inside = i >= start && i < end;
            isolated.append(inside || c == '\n' || c == '\r' ? c : ' ');
        }
        return isolated.toString();
    }
}
