package io.github.nicechester.logos.model;

import java.util.List;

/**
 * A found verse with its enriched tokens.
 */
public record VerseResponse(
    /**
     * Canonical reference (e.g., "Matt.1.1")
     */
    String reference,

    List<TokenResponse> tokens
) {
}
