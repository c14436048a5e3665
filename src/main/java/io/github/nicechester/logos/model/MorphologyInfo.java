package io.github.nicechester.logos.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured morphology decoded from an RMAC code.
 *
 * <p>Every scalar field is nullable; only the fields that apply to the part of speech are set.
 * A conjunction carries just {@code pos}, a finite verb never carries case or gender, a
 * participle never carries person or mood.
 *
 * <p>Instances are immutable. Sub-parsers derive refined copies through {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class MorphologyInfo {

    /**
     * Part of speech (e.g., "Verb", "Noun", "PersonalPronoun")
     */
    String pos;

    /**
     * Verb tense (e.g., "Present", "Aorist", "SecondAorist")
     */
    String tense;

    /**
     * Verb voice (e.g., "Active", "MiddleOrPassive", "Deponent")
     */
    String voice;

    /**
     * "Finite", "Participle" or "Infinitive"; set whenever pos is "Verb"
     */
    String verbForm;

    /**
     * Mood of a finite verb: "Indicative", "Subjunctive", "Imperative" or "Optative"
     */
    String mood;

    /**
     * Grammatical case (e.g., "Nominative", "Genitive")
     */
    @JsonProperty("case")
    String grammaticalCase;

    /**
     * "Singular" or "Plural"
     */
    String number;

    /**
     * "Masculine", "Feminine" or "Neuter"
     */
    String gender;

    /**
     * "First", "Second" or "Third"
     */
    String person;

    /**
     * Secondary markers in the order they were found (e.g., "Deponent", "ProperName", "Title").
     * Never null.
     */
    @Singular
    List<String> flags;
}
