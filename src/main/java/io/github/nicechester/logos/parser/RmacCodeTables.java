package io.github.nicechester.logos.parser;

import java.util.Map;
import java.util.Set;

/**
 * Static code tables for Robinson's Morphological Analysis Codes.
 *
 * <p>Values are the names emitted in {@link io.github.nicechester.logos.model.MorphologyInfo}.
 * The person, case, number and gender vocabularies are shared by the verb, pronoun and
 * nominal layouts.
 */
final class RmacCodeTables {

    static final String VERB = "Verb";
    static final String ADVERB = "Adverb";
    static final String PERSONAL_PRONOUN = "PersonalPronoun";

    static final String FINITE = "Finite";
    static final String PARTICIPLE = "Participle";
    static final String INFINITIVE = "Infinitive";

    static final String DEPONENT_FLAG = "Deponent";
    static final String THIRD_PERSON = "Third";

    static final char INFINITIVE_MARKER = 'N';
    static final char PARTICIPLE_MARKER = 'P';
    static final char SECONDARY_TENSE_MARKER = '2';

    static final Map<String, String> PART_OF_SPEECH = Map.ofEntries(
        Map.entry("A", "Adjective"),
        Map.entry("ADV", ADVERB),
        Map.entry("ARAM", "Aramaic"),
        Map.entry("C", "ReciprocalPronoun"),
        Map.entry("CONJ", "Conjunction"),
        Map.entry("D", "DemonstrativePronoun"),
        Map.entry("F", "ReflexivePronoun"),
        Map.entry("HEB", "Hebrew"),
        Map.entry("I", "InterrogativePronoun"),
        Map.entry("INJ", "Interjection"),
        Map.entry("K", "CorrelativePronoun"),
        Map.entry("N", "Noun"),
        Map.entry("P", PERSONAL_PRONOUN),
        Map.entry("PREP", "Preposition"),
        Map.entry("PRT", "Particle"),
        Map.entry("Q", "CorrelativeAdjective"),
        Map.entry("R", "RelativePronoun"),
        Map.entry("S", "PossessivePronoun"),
        Map.entry("T", "Article"),
        Map.entry("V", VERB),
        Map.entry("X", "IndefinitePronoun")
    );

    // Indeclinable types that carry nothing but an optional flag
    static final Set<String> SIMPLE_TYPES = Set.of("CONJ", "INJ", "ARAM", "HEB", "PRT", "PREP");

    static final Map<Character, String> CASES = Map.of(
        'A', "Accusative",
        'D', "Dative",
        'G', "Genitive",
        'N', "Nominative",
        'V', "Vocative"
    );

    static final Map<Character, String> NUMBERS = Map.of(
        'S', "Singular",
        'P', "Plural"
    );

    static final Map<Character, String> GENDERS = Map.of(
        'M', "Masculine",
        'F', "Feminine",
        'N', "Neuter"
    );

    static final Map<Character, String> PERSONS = Map.of(
        '1', "First",
        '2', "Second",
        '3', THIRD_PERSON
    );

    static final Map<String, String> TENSES = Map.ofEntries(
        Map.entry("P", "Present"),
        Map.entry("I", "Imperfect"),
        Map.entry("F", "Future"),
        Map.entry("A", "Aorist"),
        Map.entry("R", "Perfect"),
        Map.entry("L", "Pluperfect"),
        Map.entry("2P", "SecondPresent"),
        Map.entry("2I", "SecondImperfect"),
        Map.entry("2F", "SecondFuture"),
        Map.entry("2A", "SecondAorist"),
        Map.entry("2R", "SecondPerfect"),
        Map.entry("2L", "SecondPluperfect")
    );

    static final Map<Character, String> VOICES = Map.of(
        'A', "Active",
        'M', "Middle",
        'P', "Passive",
        'E', "MiddleOrPassive",
        'D', "Deponent",
        'N', "MiddleOrPassiveDeponent",
        'O', "PassiveDeponent"
    );

    static final Set<Character> DEPONENT_VOICES = Set.of('D', 'N', 'O');

    static final Map<Character, String> FINITE_MOODS = Map.of(
        'I', "Indicative",
        'S', "Subjunctive",
        'M', "Imperative",
        'O', "Optative"
    );

    static final Map<String, String> FLAGS = Map.ofEntries(
        Map.entry("C", "Comparative"),
        Map.entry("I", "Interrogative"),
        Map.entry("K", "Krasis"),
        Map.entry("L", "Location"),
        Map.entry("LG", "LocationGentilic"),
        Map.entry("LI", "LetterIndeclinable"),
        Map.entry("N", "Negative"),
        Map.entry("NUI", "IndeclinableNumber"),
        Map.entry("P", "ProperName"),
        Map.entry("PG", "PersonGentilic"),
        Map.entry("S", "Superlative"),
        Map.entry("T", "Title"),
        Map.entry("A", "Accusative"),
        Map.entry("D", "Dative"),
        Map.entry("G", "Genitive")
    );

    private RmacCodeTables() {
    }

    /**
     * Looks up the character at {@code index}, or null when the string is too short or the
     * character is not in the table.
     */
    static String charAt(String modifiers, int index, Map<Character, String> table) {
        return modifiers.length() > index ? table.get(modifiers.charAt(index)) : null;
    }
}
