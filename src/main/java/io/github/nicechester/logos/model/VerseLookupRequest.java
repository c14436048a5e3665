package io.github.nicechester.logos.model;

import java.util.List;

/**
 * Request body for verse lookups.
 */
public record VerseLookupRequest(
    /**
     * References in any supported format (e.g., "Matt.1.1", "John 3:16", "1 Cor 13:4")
     */
    List<String> verseReferences
) {
    public VerseLookupRequest {
        if (verseReferences == null) verseReferences = List.of();
    }
}
