package com.raditha.unnest.suggestion;

import java.util.Optional;

/**
 * A name and/or descriptive comment for an extracted subroutine.
 *
 * @param name    proposed subroutine name, may be null
 * @param comment free text comment placed above the subroutine, may be null
 */
public record Suggestion(String name, String comment) {

    public static Suggestion named(String name) {
        return new Suggestion(name, null);
    }

    public Optional<String> nameIfPresent() {
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name.strip());
    }

    public Optional<String> commentIfPresent() {
        return comment == null || comment.isBlank() ? Optional.empty() : Optional.of(comment.strip());
    }
}
