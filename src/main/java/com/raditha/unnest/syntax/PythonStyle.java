package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;

import java.util.List;
import java.util.Optional;

/**
 * Rendering for Python, where a colon opens a suite and dedenting closes it.
 */
public class PythonStyle implements CodeStyle {

    private final ConditionInverter inverter = new ConditionInverter(Dialect.PYTHON);

    @Override
    public Dialect dialect() {
        return Dialect.PYTHON;
    }

    @Override
    public String openIf(String condition) {
        return "if " + inverter.singleLine(condition) + ":";
    }

    @Override
    public String openElseIf(String condition) {
        return "elif " + inverter.singleLine(condition) + ":";
    }

    @Override
    public String openElse() {
        return "else:";
    }

    @Override
    public Optional<String> close() {
        return Optional.empty();
    }

    @Override
    public Optional<String> emptyBody() {
        return Optional.of("pass");
    }

    @Override
    public String statement(String text) {
        return text;
    }

    @Override
    public String negate(String condition) {
        return inverter.invert(condition);
    }

    @Override
    public List<String> comment(String text) {
        return text.strip().lines().map(line -> "# " + line.strip()).toList();
    }

    @Override
    public boolean isValidIdentifier(String name) {
        return Keywords.isValidIdentifier(Dialect.PYTHON, name);
    }
}
