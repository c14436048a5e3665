package io.github.nicechester.logos.parser;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free-form New Testament verse references to the canonical
 * {@code Book.Chapter.Verse} key used by the verse dataset.
 *
 * <p>Examples:
 * <ul>
 *   <li>"1 Corinthians 13:4" → "1Cor.13.4"</li>
 *   <li>"II Cor 5-17" → "2Cor.5.17"</li>
 *   <li>"matt.01.01" → "Matt.1.1"</li>
 * </ul>
 */
@Component
public class VerseReferenceNormalizer {

    /**
     * Groups: 1=numeric or ordinal prefix (optional), 2=book name, 3=chapter, 4=verse.
     * Separators between book, chapter and verse may be '.', ':', '-' or whitespace.
     */
    private static final Pattern VERSE_REFERENCE_PATTERN = Pattern.compile(
        "^\\s*(?:(\\d|I{1,3}|First|Second|Third)\\s*)?([A-Za-z]+)[\\s.]*(\\d+)[\\s:.\\-]+(\\d+)\\s*$",
        Pattern.CASE_INSENSITIVE);

    // Lower-case alias -> canonical book code
    private static final Map<String, String> BOOK_ALIASES = createBookAliases();

    /**
     * Normalizes a reference, failing fast on invalid input.
     *
     * @throws InvalidVerseReferenceException if the input cannot be normalized
     */
    public String normalize(String input) {
        return tryNormalize(input).orElseThrow(() -> new InvalidVerseReferenceException(input));
    }

    /**
     * Normalizes a reference.
     *
     * @return the canonical reference, or empty when the input is blank, malformed or names an
     *         unknown book
     */
    public Optional<String> tryNormalize(String input) {
        if (input == null || input.isBlank()) {
            return Optional.empty();
        }

        Matcher matcher = VERSE_REFERENCE_PATTERN.matcher(input);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        String lookupKey = (normalizeNumberPrefix(matcher.group(1)) + matcher.group(2)).toLowerCase(Locale.ROOT);
        String book = BOOK_ALIASES.get(lookupKey);
        if (book == null) {
            return Optional.empty();
        }

        String chapter = Digits.stripLeadingZeros(matcher.group(3));
        String verse = Digits.stripLeadingZeros(matcher.group(4));
        return Optional.of(book + "." + chapter + "." + verse);
    }

    public boolean isValid(String input) {
        return tryNormalize(input).isPresent();
    }

    /**
     * I / First → 1, II / Second → 2, III / Third → 3; digits pass through.
     */
    private static String normalizeNumberPrefix(String prefix) {
        if (prefix == null) {
            return "";
        }
        return switch (prefix.toUpperCase(Locale.ROOT)) {
            case "I", "FIRST" -> "1";
            case "II", "SECOND" -> "2";
            case "III", "THIRD" -> "3";
            default -> prefix;
        };
    }

    private static Map<String, String> createBookAliases() {
        Map<String, String> aliases = new HashMap<>();

        addBook(aliases, "Matt", "matthew", "mat", "mt");
        addBook(aliases, "Mark", "mrk", "mk", "mr");
        addBook(aliases, "Luke", "luk", "lk");
        addBook(aliases, "John", "jhn", "jn");
        addBook(aliases, "Acts", "act", "ac");
        addBook(aliases, "Rom", "romans", "rm", "ro");
        addBook(aliases, "1Cor", "1corinthians", "1co");
        addBook(aliases, "2Cor", "2corinthians", "2co");
        addBook(aliases, "Gal", "galatians", "ga");
        addBook(aliases, "Eph", "ephesians", "ep");
        addBook(aliases, "Phil", "philippians", "php", "pp");
        addBook(aliases, "Col", "colossians");
        addBook(aliases, "1Thess", "1thessalonians", "1thes", "1th");
        addBook(aliases, "2Thess", "2thessalonians", "2thes", "2th");
        addBook(aliases, "1Tim", "1timothy", "1ti");
        addBook(aliases, "2Tim", "2timothy", "2ti");
        addBook(aliases, "Titus", "tit", "ti");
        addBook(aliases, "Phlm", "philemon", "phm", "pm");
        addBook(aliases, "Heb", "hebrews", "he");
        addBook(aliases, "Jas", "james", "jm", "jam");
        addBook(aliases, "1Pet", "1peter", "1pe", "1pt");
        addBook(aliases, "2Pet", "2peter", "2pe", "2pt");
        addBook(aliases, "1John", "1jhn", "1jn");
        addBook(aliases, "2John", "2jhn", "2jn");
        addBook(aliases, "3John", "3jhn", "3jn");
        addBook(aliases, "Jude", "jud", "jd");
        addBook(aliases, "Rev", "revelation", "revelations", "re", "apocalypse");

        return Map.copyOf(aliases);
    }

    // The canonical code is always its own alias so normalized references re-normalize to themselves
    private static void addBook(Map<String, String> aliases, String canonical, String... alternatives) {
        aliases.put(canonical.toLowerCase(Locale.ROOT), canonical);
        for (String alternative : alternatives) {
            aliases.put(alternative, canonical);
        }
    }
}
