package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps between character offsets and 1-indexed line/column positions of a text.
 */
public class LineIndex {

    private final String text;
    private final int[] lineStarts;

    public LineIndex(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /**
     * Line containing an offset. An offset equal to the text length belongs to the last line.
     */
    public int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo + 1;
    }

    public int lineStart(int line) {
        return lineStarts[line - 1];
    }

    /**
     * Offset just past the last character of a line, excluding the line terminator.
     */
    public int lineEnd(int line) {
        int end = line < lineStarts.length ? lineStarts[line] - 1 : text.length();
        if (end > lineStart(line) && text.charAt(end - 1) == '\r') {
            end--;
        }
        return end;
    }

    /**
     * Offset of a 1-indexed line and column.
     */
    public int offsetOf(int line, int column) {
        return lineStart(line) + column - 1;
    }

    /**
     * Leading whitespace of the line containing an offset.
     */
    public String indentationAt(int offset) {
        int start = lineStart(lineOf(offset));
        int i = start;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return text.substring(start, i);
    }

    /**
     * Whether only whitespace precedes an offset on its line.
     */
    public boolean startsLine(int offset) {
        int start = lineStart(lineOf(offset));
        for (int i = start; i < offset; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    public Span span(int start, int end) {
        int endLine = end > start ? lineOf(end - 1) : lineOf(start);
        return new Span(start, end, lineOf(start), endLine);
    }
}
