package io.github.nicechester.logos.service;

import io.github.nicechester.logos.model.TokenResponse;
import io.github.nicechester.logos.model.VerseLookupResult;
import io.github.nicechester.logos.model.VerseResponse;
import io.github.nicechester.logos.parser.RmacParser;
import io.github.nicechester.logos.parser.StrongsNumberNormalizer;
import io.github.nicechester.logos.parser.VerseReferenceNormalizer;
import io.github.nicechester.logos.service.BibleDataService.TokenData;
import io.github.nicechester.logos.service.BibleDataService.VerseData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Looks up verses by free-form reference and enriches every word with parsed morphology and
 * its lexicon entry.
 *
 * <p>Flow:
 * <ol>
 *   <li>Normalize each reference; unparseable ones go straight to not-found</li>
 *   <li>Look up each normalized reference in the verse dataset</li>
 *   <li>Map tokens, parsing RMAC codes and resolving Strong's numbers against the lexicon</li>
 * </ol>
 * A bad reference or RMAC code never aborts the remaining lookups.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerseLookupService {

    private final BibleDataService bibleDataService;
    private final VerseReferenceNormalizer referenceNormalizer;
    private final StrongsNumberNormalizer strongsNormalizer;
    private final RmacParser rmacParser;

    public VerseLookupResult lookupVerses(Collection<String> references) {
        if (references == null || references.isEmpty()) {
            return VerseLookupResult.empty();
        }

        log.info("Starting verse lookup for {} references", references.size());

        List<String> normalized = new ArrayList<>();
        List<String> failedToNormalize = new ArrayList<>();
        for (String reference : references) {
            Optional<String> canonical = referenceNormalizer.tryNormalize(reference);
            if (canonical.isPresent()) {
                normalized.add(canonical.get());
            } else {
                log.warn("Failed to normalize verse reference: {}", reference);
                failedToNormalize.add(reference);
            }
        }

        List<VerseResponse> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String reference : normalized) {
            Optional<VerseData> verse = bibleDataService.findVerse(reference);
            if (verse.isPresent()) {
                found.add(new VerseResponse(reference, enrichTokens(verse.get())));
            } else {
                log.warn("Verse not found in dataset: {}", reference);
                missing.add(reference);
            }
        }

        List<String> notFound = new ArrayList<>(failedToNormalize);
        notFound.addAll(missing);

        log.info("Verse lookup complete. Found: {}, NotFound: {}", found.size(), notFound.size());
        return new VerseLookupResult(Collections.unmodifiableList(found), Collections.unmodifiableList(notFound));
    }

    private List<TokenResponse> enrichTokens(VerseData verse) {
        if (verse.getTokens() == null) {
            return List.of();
        }
        // Null entries in the dataset are skipped
        return verse.getTokens().stream()
            .filter(Objects::nonNull)
            .map(this::toTokenResponse)
            .toList();
    }

    private TokenResponse toTokenResponse(TokenData token) {
        return TokenResponse.builder()
            .gloss(token.getGloss())
            .greek(token.getGreek())
            .translit(token.getTranslit())
            .strongs(token.getStrongs())
            .rmac(token.getRmac())
            .rmacDesc(token.getRmacDesc())
            .morph(rmacParser.parse(token.getRmac()).orElse(null))
            .lexiconEntry(resolveLexiconEntry(token))
            .build();
    }

    /**
     * Lexicon definition for the token's Strong's number, falling back to the definition stored
     * on the token itself.
     */
    private String resolveLexiconEntry(TokenData token) {
        return strongsNormalizer.tryNormalize(token.getStrongs())
            .flatMap(bibleDataService::findDefinition)
            .orElse(token.getStrongDef());
    }
}
