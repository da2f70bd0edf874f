package com.raditha.unnest.model;

/**
 * A half-open character range of the unit text together with the lines it covers.
 *
 * @param start     first character offset (inclusive)
 * @param end       last character offset (exclusive)
 * @param startLine starting line number (1-indexed)
 * @param endLine   ending line number (1-indexed, inclusive)
 */
public record Span(int start, int end, int startLine, int endLine) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span offsets " + start + ".." + end);
        }
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid span lines " + startLine + ".." + endLine);
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(Span other) {
        return other.start >= start && other.end <= end;
    }

    public boolean overlaps(Span other) {
        return other.start < end && start < other.end;
    }

    /**
     * Get total number of lines in this span.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
