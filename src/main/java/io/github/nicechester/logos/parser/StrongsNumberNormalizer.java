package io.github.nicechester.logos.parser;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes Strong's Concordance numbers to their canonical form: an upper-case {@code G}
 * (Greek) or {@code H} (Hebrew) followed by the number without leading zeros.
 *
 * <p>Examples: "g 0025" → "G25", "H0001" → "H1", "G000" → "G0".
 */
@Component
public class StrongsNumberNormalizer {

    // Groups: 1=prefix, 2=digits
    private static final Pattern STRONGS_PATTERN =
        Pattern.compile("^\\s*([GH])\\s*(\\d+)\\s*$", Pattern.CASE_INSENSITIVE);

    /**
     * Normalizes a Strong's number, failing fast on invalid input.
     *
     * @throws InvalidStrongsNumberException if the input cannot be normalized
     */
    public String normalize(String input) {
        return tryNormalize(input).orElseThrow(() -> new InvalidStrongsNumberException(input));
    }

    /**
     * Normalizes a Strong's number.
     *
     * @return the canonical number, or empty for null, blank or malformed input
     */
    public Optional<String> tryNormalize(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = STRONGS_PATTERN.matcher(input);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String prefix = matcher.group(1).toUpperCase(Locale.ROOT);
        return Optional.of(prefix + Digits.stripLeadingZeros(matcher.group(2)));
    }

    public boolean isValid(String input) {
        return tryNormalize(input).isPresent();
    }
}
