package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rendering for the brace dialects: Java, C, C++, C#, JavaScript and TypeScript.
 * Braces open on the header line and {@code else} shares the line of the closing brace.
 */
public class BraceStyle implements CodeStyle {

    private final Dialect dialect;
    private final ConditionInverter inverter;

    public BraceStyle(Dialect dialect) {
        this.dialect = dialect;
        this.inverter = new ConditionInverter(dialect);
    }

    @Override
    public Dialect dialect() {
        return dialect;
    }

    @Override
    public String openIf(String condition) {
        return "if (" + inverter.singleLine(condition) + ") {";
    }

    @Override
    public String openElseIf(String condition) {
        return "} else if (" + inverter.singleLine(condition) + ") {";
    }

    @Override
    public String openElse() {
        return "} else {";
    }

    @Override
    public Optional<String> close() {
        return Optional.of("}");
    }

    @Override
    public Optional<String> emptyBody() {
        return Optional.empty();
    }

    @Override
    public String statement(String text) {
        return text + ";";
    }

    @Override
    public String negate(String condition) {
        return inverter.invert(condition);
    }

    @Override
    public List<String> comment(String text) {
        List<String> lines = new ArrayList<>();
        List<String> content = text.strip().lines().map(String::strip).toList();
        if (dialect == Dialect.JAVA) {
            if (content.size() == 1) {
                lines.add("/** " + content.get(0) + " */");
            } else {
                lines.add("/**");
                content.forEach(line -> lines.add(" * " + line));
                lines.add(" */");
            }
            return lines;
        }
        content.forEach(line -> lines.add("// " + line));
        return lines;
    }

    @Override
    public boolean isValidIdentifier(String name) {
        return Keywords.isValidIdentifier(dialect, name);
    }
}
