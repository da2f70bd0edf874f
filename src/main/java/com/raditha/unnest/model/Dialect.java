package com.raditha.unnest.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Source dialects understood by the engine.
 * Each dialect is bound to one structural indexing strategy.
 */
public enum Dialect {
    JAVA(AdapterStrategy.TREE, true, Set.of("java")),
    C(AdapterStrategy.DELIMITER, true, Set.of("c", "h")),
    CPP(AdapterStrategy.DELIMITER, true, Set.of("cpp", "cc", "cxx", "hpp", "hh", "hxx")),
    CSHARP(AdapterStrategy.DELIMITER, true, Set.of("cs")),
    JAVASCRIPT(AdapterStrategy.DELIMITER, false, Set.of("js", "mjs", "cjs", "jsx")),
    TYPESCRIPT(AdapterStrategy.DELIMITER, false, Set.of("ts", "tsx")),
    PYTHON(AdapterStrategy.INDENTATION, false, Set.of("py", "pyw")),
    GENERIC(AdapterStrategy.INDENTATION, false, Set.of());

    private final AdapterStrategy strategy;
    private final boolean typed;
    private final Set<String> extensions;

    Dialect(AdapterStrategy strategy, boolean typed, Set<String> extensions) {
        this.strategy = strategy;
        this.typed = typed;
        this.extensions = extensions;
    }

    public AdapterStrategy strategy() {
        return strategy;
    }

    /**
     * Whether subroutine parameters need declared types in this dialect.
     */
    public boolean isTyped() {
        return typed;
    }

    /**
     * Whether functions must be declared before they are called.
     */
    public boolean requiresDeclarationBeforeUse() {
        return this == C || this == CPP;
    }

    /**
     * Resolve a dialect from a file name by extension.
     * Unknown extensions map to {@link #GENERIC}.
     */
    public static Dialect fromFileName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return GENERIC;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (Dialect dialect : values()) {
            if (dialect.extensions.contains(ext)) {
                return dialect;
            }
        }
        return GENERIC;
    }

    /**
     * Resolve a dialect tag such as "java", "js", "c++" or "py".
     */
    public static Optional<Dialect> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Optional.ofNullable(switch (normalized) {
            case "java" -> JAVA;
            case "c" -> C;
            case "cpp", "c++", "cxx" -> CPP;
            case "csharp", "c#", "cs" -> CSHARP;
            case "javascript", "js", "node" -> JAVASCRIPT;
            case "typescript", "ts" -> TYPESCRIPT;
            case "python", "py", "python3" -> PYTHON;
            case "generic", "text", "unknown" -> GENERIC;
            default -> null;
        });
    }

    /**
     * Structural indexing strategy used for a dialect.
     */
    public enum AdapterStrategy {
        TREE, // native parse tree
        DELIMITER, // brace counting with a lexical pre-pass
        INDENTATION // leading whitespace run length
    }
}
