package io.github.nicechester.logos.model;

import java.util.List;

/**
 * Outcome of a verse lookup over several references.
 */
public record VerseLookupResult(
    /**
     * Verses that were found, in request order
     */
    List<VerseResponse> verses,

    /**
     * Inputs that could not be normalized (verbatim), followed by normalized references
     * missing from the dataset
     */
    List<String> notFound
) {
    public static VerseLookupResult empty() {
        return new VerseLookupResult(List.of(), List.of());
    }
}
