package io.github.nicechester.logos.parser;

import io.github.nicechester.logos.model.MorphologyInfo;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

import static io.github.nicechester.logos.parser.RmacCodeTables.*;

/**
 * Decodes Robinson's Morphological Analysis Codes (RMAC) into {@link MorphologyInfo}.
 *
 * <p>Dispatch is greedy on the shape of the code, first match wins:
 * <ol>
 *   <li>indeclinable types ({@code CONJ}, {@code PREP}, ...) with an optional flag</li>
 *   <li>adverbs ({@code ADV}, {@code ADV-C})</li>
 *   <li>verbs ({@code V-AAI-3S}, {@code V-2AAN}, {@code V-PAP-NSM})</li>
 *   <li>personal pronouns ({@code P-1NS}, {@code P-ASM})</li>
 *   <li>everything else as a nominal ({@code N-GSM-P}, {@code T-NSM}, {@code A-NSM-C})</li>
 * </ol>
 *
 * <p>An unparseable code yields {@link Optional#empty()} rather than an exception, so a verse
 * with one malformed code still yields morphology for its other words. Unknown characters inside
 * a recognized layout leave the corresponding field unset.
 */
@Component
public class RmacParser {

    private static final String DELIMITER = "-";

    /**
     * Parses an RMAC code.
     *
     * @param rmacCode code such as "V-AAI-3S" or "N-GSM-P"; case and surrounding whitespace
     *                 are ignored
     * @return the decoded morphology, or empty when the code is null, blank or unrecognized
     */
    public Optional<MorphologyInfo> parse(String rmacCode) {
        if (rmacCode == null || rmacCode.isBlank()) {
            return Optional.empty();
        }

        String code = rmacCode.trim().toUpperCase(Locale.ROOT);
        String[] parts = code.split(DELIMITER);
        if (parts.length == 0) {
            return Optional.empty();
        }

        if (SIMPLE_TYPES.contains(parts[0])) {
            return Optional.of(parseSimpleType(parts));
        }
        if (code.startsWith("ADV")) {
            return Optional.of(parseAdverb(parts));
        }
        if (code.startsWith("V-")) {
            return parseVerb(parts);
        }
        if (code.startsWith("P-")) {
            return parsePersonalPronoun(parts);
        }
        return parseNominal(parts);
    }

    /**
     * Whether {@link #parse(String)} would produce a result.
     */
    public boolean isValid(String rmacCode) {
        return parse(rmacCode).isPresent();
    }

    private MorphologyInfo parseSimpleType(String[] parts) {
        return withFlag(MorphologyInfo.builder().pos(PART_OF_SPEECH.get(parts[0])), parts, 1).build();
    }

    private MorphologyInfo parseAdverb(String[] parts) {
        return withFlag(MorphologyInfo.builder().pos(ADVERB), parts, 1).build();
    }

    /**
     * V-{tense}{voice}{mood}[-{person}{number} | -{case}{number}{gender}]
     */
    private Optional<MorphologyInfo> parseVerb(String[] parts) {
        if (parts.length < 2 || parts[1].length() < 3) {
            return Optional.empty();
        }

        String modifiers = parts[1];
        boolean secondaryTense = modifiers.charAt(0) == SECONDARY_TENSE_MARKER && modifiers.length() >= 4;
        int voiceIndex = secondaryTense ? 2 : 1;
        char voiceCode = modifiers.charAt(voiceIndex);
        char formCode = modifiers.charAt(voiceIndex + 1);

        MorphologyInfo.MorphologyInfoBuilder verb = MorphologyInfo.builder()
            .pos(VERB)
            .tense(TENSES.get(modifiers.substring(0, voiceIndex)))
            .voice(VOICES.get(voiceCode));
        if (DEPONENT_VOICES.contains(voiceCode)) {
            verb.flag(DEPONENT_FLAG);
        }
        MorphologyInfo base = verb.build();

        String inflection = parts.length >= 3 ? parts[2] : "";

        if (formCode == INFINITIVE_MARKER) {
            return Optional.of(base.toBuilder().verbForm(INFINITIVE).build());
        }
        if (formCode == PARTICIPLE_MARKER) {
            return Optional.of(withParticipleInflection(base, inflection));
        }
        return Optional.of(withFiniteInflection(base, formCode, inflection));
    }

    private MorphologyInfo withParticipleInflection(MorphologyInfo base, String caseNumberGender) {
        return base.toBuilder()
            .verbForm(PARTICIPLE)
            .grammaticalCase(charAt(caseNumberGender, 0, CASES))
            .number(charAt(caseNumberGender, 1, NUMBERS))
            .gender(charAt(caseNumberGender, 2, GENDERS))
            .build();
    }

    private MorphologyInfo withFiniteInflection(MorphologyInfo base, char moodCode, String personNumber) {
        return base.toBuilder()
            .verbForm(FINITE)
            .mood(FINITE_MOODS.get(moodCode))
            .person(charAt(personNumber, 0, PERSONS))
            .number(charAt(personNumber, 1, NUMBERS))
            .build();
    }

    /**
     * P-{person}{case}[{number}] for first and second person, P-{case}[{number}[{gender}]]
     * for the implied third person.
     */
    private Optional<MorphologyInfo> parsePersonalPronoun(String[] parts) {
        if (parts.length < 2 || parts[1].length() < 2) {
            return Optional.empty();
        }

        String modifiers = parts[1];
        String person = PERSONS.get(modifiers.charAt(0));
        MorphologyInfo.MorphologyInfoBuilder pronoun = MorphologyInfo.builder().pos(PERSONAL_PRONOUN);

        if (person != null) {
            pronoun.person(person)
                .grammaticalCase(charAt(modifiers, 1, CASES))
                .number(charAt(modifiers, 2, NUMBERS));
        } else {
            pronoun.person(THIRD_PERSON)
                .grammaticalCase(charAt(modifiers, 0, CASES))
                .number(charAt(modifiers, 1, NUMBERS))
                .gender(charAt(modifiers, 2, GENDERS));
        }

        return Optional.of(withFlag(pronoun, parts, 2).build());
    }

    private Optional<MorphologyInfo> parseNominal(String[] parts) {
        if (parts.length < 2) {
            return Optional.empty();
        }

        String pos = PART_OF_SPEECH.get(parts[0]);
        if (pos == null) {
            return Optional.empty();
        }

        String caseNumberGender = parts[1];
        MorphologyInfo.MorphologyInfoBuilder nominal = MorphologyInfo.builder()
            .pos(pos)
            .grammaticalCase(charAt(caseNumberGender, 0, CASES))
            .number(charAt(caseNumberGender, 1, NUMBERS))
            .gender(charAt(caseNumberGender, 2, GENDERS));

        return Optional.of(withFlag(nominal, parts, 2).build());
    }

    // Unrecognized suffixes are dropped
    private static MorphologyInfo.MorphologyInfoBuilder withFlag(
            MorphologyInfo.MorphologyInfoBuilder builder, String[] parts, int index) {
        if (parts.length > index) {
            String flag = FLAGS.get(parts[index]);
            if (flag != null) {
                builder.flag(flag);
            }
        }
        return builder;
    }
}
