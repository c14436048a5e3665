package io.github.nicechester.logos.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.logos.service.BibleDataService.TokenData;
import io.github.nicechester.logos.service.BibleDataService.VerseData;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BibleDataServiceTest {

    private static final String VERSES = "classpath:data/test-verses.json";
    private static final String LEXICON = "classpath:data/test-lexicon.json";

    private BibleDataService load(String versesPath, String lexiconPath) {
        BibleDataService service = new BibleDataService(new DefaultResourceLoader(), new ObjectMapper());
        ReflectionTestUtils.setField(service, "versesPath", versesPath);
        ReflectionTestUtils.setField(service, "lexiconPath", lexiconPath);
        service.loadBibleData();
        return service;
    }

    @Test
    void loadsVersesAndLexicon() {
        BibleDataService service = load(VERSES, LEXICON);

        assertTrue(service.isInitialized());
        assertEquals(2, service.getVersesCount());
        assertEquals(2, service.getLexiconCount());
    }

    @Test
    void mapsTokenFieldsIncludingSnakeCaseProperties() {
        BibleDataService service = load(VERSES, LEXICON);

        VerseData verse = service.findVerse("Matt.1.1").orElseThrow();
        assertEquals(2, verse.getTokens().size());

        TokenData jesus = verse.getTokens().get(1);
        assertEquals("of Jesus", jesus.getGloss());
        assertEquals("G2424", jesus.getStrongs());
        assertEquals("N-GSM-P", jesus.getRmac());
        assertEquals("Noun, Genitive, Singular, Masculine, Person", jesus.getRmacDesc());
        assertEquals("Jesus (stored on token)", jesus.getStrongDef());
    }

    @Test
    void ignoresUnknownTokenProperties() {
        BibleDataService service = load(VERSES, LEXICON);

        assertEquals("G25", service.findVerse("John.3.16").orElseThrow().getTokens().get(0).getStrongs());
    }

    @Test
    void lookupsAreExactMatch() {
        BibleDataService service = load(VERSES, LEXICON);

        assertEquals(Optional.of("to love"), service.findDefinition("G25"));
        assertTrue(service.findDefinition("g25").isEmpty());
        assertTrue(service.findDefinition(null).isEmpty());
        assertTrue(service.findVerse("Matt 1:1").isEmpty());
        assertTrue(service.findVerse(null).isEmpty());
    }

    @Test
    void missingFileLeavesServiceUninitialized() {
        BibleDataService service = load("classpath:data/does-not-exist.json", LEXICON);

        assertFalse(service.isInitialized());
        assertEquals(0, service.getVersesCount());
        assertEquals(2, service.getLexiconCount());
    }

    @Test
    void malformedFileLeavesServiceUninitialized() {
        BibleDataService service = load(VERSES, "classpath:data/malformed.json");

        assertFalse(service.isInitialized());
        assertEquals(2, service.getVersesCount());
        assertEquals(0, service.getLexiconCount());
    }
}
