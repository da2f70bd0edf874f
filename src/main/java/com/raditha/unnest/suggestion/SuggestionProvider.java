package com.raditha.unnest.suggestion;

import com.raditha.unnest.model.RegionFingerprint;

import java.util.Optional;

/**
 * Optional source of names and comments for extracted subroutines, such as a language model.
 * <p>
 * Implementations only ever see the structural fingerprint of a region. Whatever they
 * return is a hint: names that are invalid or already taken are ignored.
 */
@FunctionalInterface
public interface SuggestionProvider {

    /**
     * Suggest a name and comment for the subroutine extracted from one root branch.
     *
     * @param fingerprint   structural fingerprint of the region
     * @param branchOrdinal 1-based index of the root branch
     * @return the suggestion, empty when there is none
     */
    Optional<Suggestion> suggest(RegionFingerprint fingerprint, int branchOrdinal);

    /**
     * A provider that never suggests anything.
     */
    static SuggestionProvider none() {
        return (fingerprint, branchOrdinal) -> Optional.empty();
    }
}
