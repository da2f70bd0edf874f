package com.raditha.unnest.model;

import java.util.List;

/**
 * A subroutine synthesized by method extraction.
 *
 * @param name            subroutine name
 * @param branchOrdinal   1-based index of the root branch it was extracted from
 * @param parameters      parameter names in call order
 * @param text            full declaration text, indented for its insertion point
 * @param insertionOffset offset in the original unit text where the declaration goes
 * @param suggested       whether the name came from the suggestion provider
 */
public record ExtractedSubroutine(
        String name,
        int branchOrdinal,
        List<String> parameters,
        String text,
        int insertionOffset,
        boolean suggested) {

    public ExtractedSubroutine {
        parameters = List.copyOf(parameters);
    }
}
