package com.raditha.unnest.syntax;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Line and indentation helpers for moving source text between nesting levels.
 */
public final class TextBlocks {

    public static final String DEFAULT_INDENT = "    ";

    private TextBlocks() {
    }

    /**
     * A run of source lines with the indentation of its first line removed.
     *
     * @param lines segment lines in order
     */
    public record Segment(List<SegmentLine> lines) {

        public Segment {
            lines = List.copyOf(lines);
        }

        public static Segment empty() {
            return new Segment(List.of());
        }

        public boolean isEmpty() {
            return lines.isEmpty();
        }
    }

    /**
     * One line of a segment.
     *
     * @param text     line content
     * @param relative whether the line was indented at least as deep as the first line, so it
     *                 takes the new indentation; other lines, such as the inside of a multi-line
     *                 string, are kept as they are
     */
    public record SegmentLine(String text, boolean relative) {
    }

    /**
     * Cut {@code [start, end)} out of a text, trimming blank edges, and express its lines
     * relative to the indentation of the line it starts on.
     */
    public static Segment segment(String text, int start, int end) {
        int from = start;
        int to = end;
        while (from < to && Character.isWhitespace(text.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
            to--;
        }
        if (from >= to) {
            return Segment.empty();
        }
        String base = indentationAt(text, from);
        List<SegmentLine> lines = new ArrayList<>();
        String[] physical = text.substring(from, to).split("\n", -1);
        for (int i = 0; i < physical.length; i++) {
            String line = stripCarriageReturn(physical[i]);
            if (i == 0) {
                lines.add(new SegmentLine(line, true));
            } else if (line.isBlank()) {
                lines.add(new SegmentLine("", true));
            } else if (line.startsWith(base)) {
                lines.add(new SegmentLine(line.substring(base.length()), true));
            } else {
                lines.add(new SegmentLine(line, false));
            }
        }
        return new Segment(lines);
    }

    /**
     * Leading whitespace of the line containing an offset.
     */
    public static String indentationAt(String text, int offset) {
        int lineStart = lineStart(text, offset);
        int i = lineStart;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(lineStart, i);
    }

    public static int lineStart(String text, int offset) {
        int i = Math.min(offset, text.length());
        while (i > 0 && text.charAt(i - 1) != '\n') {
            i--;
        }
        return i;
    }

    /**
     * Line terminator used by a text.
     */
    public static String newline(String text) {
        return text.contains("\r\n") ? "\r\n" : "\n";
    }

    /**
     * Indentation step between a header at {@code outer} and its first body line at
     * {@code inner}, falling back to the unit-wide step when the body shares the header line.
     */
    public static String indentUnit(String text, int outer, int inner) {
        String outerIndent = indentationAt(text, outer);
        String innerIndent = indentationAt(text, inner);
        boolean ownLine = lineStart(text, inner) != lineStart(text, outer);
        if (ownLine && innerIndent.length() > outerIndent.length() && innerIndent.startsWith(outerIndent)) {
            return innerIndent.substring(outerIndent.length());
        }
        return indentUnit(text);
    }

    /**
     * Most frequent indentation increase between consecutive non-blank lines of a text.
     */
    public static String indentUnit(String text) {
        Map<Integer, Integer> increases = new HashMap<>();
        int previous = 0;
        for (String raw : text.split("\n")) {
            String line = stripCarriageReturn(raw);
            String stripped = line.strip();
            if (stripped.isEmpty() || stripped.startsWith("*")) {
                continue;
            }
            if (line.startsWith("\t")) {
                return "\t";
            }
            int width = line.length() - line.stripLeading().length();
            if (width > previous) {
                increases.merge(width - previous, 1, Integer::sum);
            }
            previous = width;
        }
        return increases.entrySet().stream()
                .max(Map.Entry.<Integer, Integer>comparingByValue().thenComparing(Map.Entry.<Integer, Integer>comparingByKey()))
                .map(e -> " ".repeat(e.getKey()))
                .orElse(DEFAULT_INDENT);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
