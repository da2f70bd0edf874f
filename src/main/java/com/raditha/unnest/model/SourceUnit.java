package com.raditha.unnest.model;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Immutable unit of source text handed to the engine by a caller.
 *
 * @param identity caller supplied identity, usually a file path
 * @param dialect  dialect of the text
 * @param text     raw source text
 */
public record SourceUnit(String identity, Dialect dialect, String text) {

    public SourceUnit {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(text, "text");
    }

    /**
     * Read a unit from disk, deriving the dialect from the file extension.
     */
    public static SourceUnit fromFile(Path path) throws IOException {
        return new SourceUnit(path.toString(), Dialect.fromFileName(path), Files.readString(path));
    }

    /**
     * Same identity and dialect with different text.
     */
    public SourceUnit withText(String newText) {
        return new SourceUnit(identity, dialect, newText);
    }

    public String slice(Span span) {
        return text.substring(span.start(), span.end());
    }
}
