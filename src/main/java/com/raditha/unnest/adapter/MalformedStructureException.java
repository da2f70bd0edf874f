package com.raditha.unnest.adapter;

/**
 * Raised when a dialect adapter cannot build a consistent block tree,
 * for example on unbalanced delimiters or inconsistent indentation.
 */
public class MalformedStructureException extends Exception {

    private final int line;
    private final int offset;

    public MalformedStructureException(String message, int line, int offset) {
        super(message + " (line " + line + ")");
        this.line = line;
        this.offset = offset;
    }

    public MalformedStructureException(String message, int line, int offset, Throwable cause) {
        super(message + " (line " + line + ")", cause);
        this.line = line;
        this.offset = offset;
    }

    public int getLine() {
        return line;
    }

    public int getOffset() {
        return offset;
    }
}
