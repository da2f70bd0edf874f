package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;

/**
 * Selects the rendering style for a dialect.
 */
public final class CodeStyles {

    private CodeStyles() {
    }

    /**
     * @throws IllegalArgumentException for {@link Dialect#GENERIC}, which has no known syntax to emit
     */
    public static CodeStyle forDialect(Dialect dialect) {
        return switch (dialect) {
            case PYTHON -> new PythonStyle();
            case GENERIC -> throw new IllegalArgumentException("No rendering syntax for dialect " + dialect);
            default -> new BraceStyle(dialect);
        };
    }

    public static boolean supports(Dialect dialect) {
        return dialect != Dialect.GENERIC;
    }
}
