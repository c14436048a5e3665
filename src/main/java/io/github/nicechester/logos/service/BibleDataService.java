package io.github.nicechester.logos.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for loading the static Greek New Testament datasets from JSON files.
 *
 * <p>Two tables are loaded once at startup and only read afterwards:
 * <ul>
 *   <li>verses: canonical reference ("Matt.1.1") → word tokens</li>
 *   <li>lexicon: Strong's number ("G976") → definition</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BibleDataService {

    private static final TypeReference<Map<String, VerseData>> VERSES_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, String>> LEXICON_TYPE = new TypeReference<>() {};

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Value("${logos.data.verses-path:classpath:data/verses.json}")
    private String versesPath;

    @Value("${logos.data.lexicon-path:classpath:data/lexicon.json}")
    private String lexiconPath;

    private final Map<String, VerseData> versesByReference = new ConcurrentHashMap<>();
    private final Map<String, String> lexicon = new ConcurrentHashMap<>();

    private volatile boolean initialized;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class VerseData {
        private List<TokenData> tokens = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TokenData {
        private String gloss;
        private String greek;
        private String translit;
        private String strongs;
        private String rmac;

        @JsonProperty("rmac_desc")
        private String rmacDesc;

        /**
         * Definition copied into the verse file by the data tooling; may be absent.
         */
        @JsonProperty("strong_def")
        private String strongDef;
    }

    @PostConstruct
    public void loadBibleData() {
        log.info("Loading Bible data...");

        boolean versesLoaded = load(versesPath, VERSES_TYPE, versesByReference, "verses");
        boolean lexiconLoaded = load(lexiconPath, LEXICON_TYPE, lexicon, "lexicon entries");
        initialized = versesLoaded && lexiconLoaded;

        log.info("Bible data loaded: {} verses, {} lexicon entries (initialized={})",
            versesByReference.size(), lexicon.size(), initialized);
    }

    private <T> boolean load(String path, TypeReference<Map<String, T>> type, Map<String, T> target, String label) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            log.warn("Data file not found for {}: {}", label, path);
            return false;
        }

        try (InputStream inputStream = resource.getInputStream()) {
            Map<String, T> data = objectMapper.readValue(inputStream, type);
            if (data == null) {
                log.error("Failed to deserialize {} from {}", label, path);
                return false;
            }
            data.forEach((key, value) -> {
                if (key != null && value != null) {
                    target.putIfAbsent(key, value);
                }
            });
            log.info("Loaded {} {} from {}", target.size(), label, path);
            return true;
        } catch (IOException e) {
            log.error("Error loading {} from {}", label, path, e);
            return false;
        }
    }

    /**
     * Get a verse by its canonical reference (Book.Chapter.Verse).
     */
    public Optional<VerseData> findVerse(String reference) {
        return reference == null ? Optional.empty() : Optional.ofNullable(versesByReference.get(reference));
    }

    /**
     * Get the lexicon definition for a canonical Strong's number.
     */
    public Optional<String> findDefinition(String strongsNumber) {
        return strongsNumber == null ? Optional.empty() : Optional.ofNullable(lexicon.get(strongsNumber));
    }

    public int getVersesCount() {
        return versesByReference.size();
    }

    public int getLexiconCount() {
        return lexicon.size();
    }

    /**
     * True once both datasets loaded without error.
     */
    public boolean isInitialized() {
        return initialized;
    }
}
