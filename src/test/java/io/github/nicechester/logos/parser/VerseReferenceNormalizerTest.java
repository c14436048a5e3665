package io.github.nicechester.logos.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class VerseReferenceNormalizerTest {

    private final VerseReferenceNormalizer normalizer = new VerseReferenceNormalizer();

    @ParameterizedTest
    @CsvSource({
        "'1 Corinthians 13:4', 1Cor.13.4",
        "Matt.01.01, Matt.1.1",
        "'John 3:16', John.3.16",
        "'john 3 16', John.3.16",
        "'Mk 1-1', Mark.1.1",
        "'  Rom 8:28  ', Rom.8.28",
        "'Rev. 22:21', Rev.22.21",
        "'Revelation 1.1', Rev.1.1",
        "'Jas 1:5', Jas.1.5",
        "Phlm.1.1, Phlm.1.1"
    })
    void normalizesCommonFormats(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @ParameterizedTest
    @CsvSource({
        "'II Cor 5:17', 2Cor.5.17",
        "'Second Corinthians 5:17', 2Cor.5.17",
        "'I John 1:9', 1John.1.9",
        "'First Peter 2:9', 1Pet.2.9",
        "'III John 1:4', 3John.1.4",
        "'Third John 1:4', 3John.1.4",
        "'1Thess 5:17', 1Thess.5.17",
        "'2 Tim 3:16', 2Tim.3.16"
    })
    void normalizesOrdinalPrefixes(String input, String expected) {
        assertEquals(expected, normalizer.normalize(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "Matt", "Mark", "Luke", "John", "Acts", "Rom", "1Cor", "2Cor", "Gal", "Eph", "Phil", "Col",
        "1Thess", "2Thess", "1Tim", "2Tim", "Titus", "Phlm", "Heb", "Jas", "1Pet", "2Pet",
        "1John", "2John", "3John", "Jude", "Rev"
    })
    void canonicalReferencesNormalizeToThemselves(String book) {
        String canonical = book + ".1.1";

        assertEquals(canonical, normalizer.normalize(canonical));
        assertEquals(canonical, normalizer.normalize(normalizer.normalize(canonical)));
    }

    @Test
    void allZeroNumbersBecomeZero() {
        assertEquals("Matt.0.0", normalizer.normalize("Matt 000:00"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Hello World", "Unknown 1:1", "Matt", "Matt 1", "Genesis 1:1", "4 John 1:1", "John 3:16a", "3:16"})
    void rejectsInvalidReferences(String input) {
        assertTrue(normalizer.tryNormalize(input).isEmpty());
        assertFalse(normalizer.isValid(input));
    }

    @Test
    void normalizeThrowsWithOffendingInput() {
        InvalidVerseReferenceException e =
            assertThrows(InvalidVerseReferenceException.class, () -> normalizer.normalize("Unknown 1:1"));

        assertEquals("Unknown 1:1", e.getInput());
        assertEquals("Invalid verse reference: 'Unknown 1:1'", e.getMessage());
    }

    @Test
    void plainTextIsRejectedWithoutThrowingFromTryNormalize() {
        assertTrue(normalizer.tryNormalize("Hello World").isEmpty());
        assertFalse(normalizer.isValid("Hello World"));

        InvalidVerseReferenceException e =
            assertThrows(InvalidVerseReferenceException.class, () -> normalizer.normalize("Hello World"));
        assertEquals("Hello World", e.getInput());
    }

    @Test
    void invalidReferenceIsAnIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> normalizer.normalize(null));
    }
}
