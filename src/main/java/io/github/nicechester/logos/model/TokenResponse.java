package io.github.nicechester.logos.model;

import lombok.Builder;
import lombok.Data;

/**
 * A word of a verse as returned by the verse lookup, enriched with parsed morphology and its
 * lexicon entry.
 */
@Data
@Builder(toBuilder = true)
public class TokenResponse {

    /**
     * English gloss of the word
     */
    private String gloss;

    /**
     * Original Greek surface form
     */
    private String greek;

    /**
     * Transliteration of the Greek
     */
    private String translit;

    /**
     * Strong's number as it appears in the dataset (e.g., "G976")
     */
    private String strongs;

    /**
     * Verbatim RMAC code (e.g., "N-NSF")
     */
    private String rmac;

    /**
     * Human-readable description of the RMAC code, carried by the dataset
     */
    private String rmacDesc;

    /**
     * Morphology parsed from the RMAC code; null when the code is not parseable
     */
    private MorphologyInfo morph;

    /**
     * Lexicon definition for the Strong's number, if known
     */
    private String lexiconEntry;
}
