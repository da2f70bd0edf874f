package com.raditha.unnest.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the lines of a rewrite at relative nesting levels.
 * <p>
 * Level 0 is the indentation of the replaced region. The first line is returned without that
 * indentation because the region's own line already carries it.
 */
public class CodeEmitter {

    private final CodeStyle style;
    private final String baseIndent;
    private final String unit;
    private final String newline;
    private final List<String> lines = new ArrayList<>();

    public CodeEmitter(CodeStyle style, String baseIndent, String unit, String newline) {
        this.style = style;
        this.baseIndent = baseIndent;
        this.unit = unit;
        this.newline = newline;
    }

    /**
     * Writes the body of one branch at a given level.
     */
    @FunctionalInterface
    public interface BodyWriter {
        void write(int level);
    }

    /**
     * One arm of an emitted conditional.
     *
     * @param condition condition text, null for the unconditional else
     * @param body      writer for the arm's body
     */
    public record Arm(String condition, BodyWriter body) {

        public static Arm when(String condition, BodyWriter body) {
            return new Arm(condition, body);
        }

        public static Arm otherwise(BodyWriter body) {
            return new Arm(null, body);
        }
    }

    public CodeStyle style() {
        return style;
    }

    public CodeEmitter line(int level, String content) {
        lines.add(content.isEmpty() ? "" : indent(level) + content);
        return this;
    }

    /**
     * Re-indent a segment of original source to a level.
     */
    public CodeEmitter segment(int level, TextBlocks.Segment segment) {
        for (TextBlocks.SegmentLine line : segment.lines()) {
            if (!line.relative()) {
                lines.add(line.text());
            } else {
                line(level, line.text());
            }
        }
        return this;
    }

    public CodeEmitter comment(int level, String text) {
        style.comment(text).forEach(c -> line(level, c));
        return this;
    }

    public CodeEmitter statement(int level, String text) {
        return line(level, style.statement(text));
    }

    /**
     * Emit an if / else-if / else chain. Empty bodies get the dialect's placeholder statement.
     */
    public CodeEmitter conditional(int level, List<Arm> arms) {
        for (int i = 0; i < arms.size(); i++) {
            Arm arm = arms.get(i);
            String opener;
            if (i == 0) {
                opener = style.openIf(arm.condition());
            } else if (arm.condition() == null) {
                opener = style.openElse();
            } else {
                opener = style.openElseIf(arm.condition());
            }
            line(level, opener);
            int before = lines.size();
            arm.body().write(level + 1);
            if (lines.size() == before) {
                style.emptyBody().ifPresent(placeholder -> line(level + 1, placeholder));
            }
        }
        style.close().ifPresent(close -> line(level, close));
        return this;
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * The emitted lines, first line without the base indentation.
     */
    public String text() {
        String joined = String.join(newline, lines);
        return joined.startsWith(baseIndent) ? joined.substring(baseIndent.length()) : joined;
    }

    /**
     * The emitted lines with full indentation, for text inserted on lines of its own.
     */
    public String block() {
        return String.join(newline, lines);
    }

    public String newline() {
        return newline;
    }

    public String unit() {
        return unit;
    }

    private String indent(int level) {
        return baseIndent + unit.repeat(level);
    }
}
