package io.github.nicechester.logos.model;

/**
 * Lexicon entry for a normalized Strong's number.
 */
public record LexiconLookupResponse(
    String strongsNumber,
    String definition
) {
}
