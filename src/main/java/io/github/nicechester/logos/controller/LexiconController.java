package io.github.nicechester.logos.controller;

import io.github.nicechester.logos.model.LexiconLookupResponse;
import io.github.nicechester.logos.parser.StrongsNumberNormalizer;
import io.github.nicechester.logos.service.BibleDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for Strong's lexicon lookups.
 */
@Slf4j
@RestController
@RequestMapping("/api/lexicon")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LexiconController {

    private final BibleDataService bibleDataService;
    private final StrongsNumberNormalizer strongsNormalizer;

    /**
     * Look up a lexicon entry by Strong's number.
     * 
     * GET /api/lexicon/G25
     *
     * <p>An invalid number is answered with 400 by {@link ApiExceptionHandler}.
     */
    @GetMapping("/{strongsNumber}")
    public ResponseEntity<?> getEntry(@PathVariable String strongsNumber) {
        log.info("Lexicon lookup: {}", strongsNumber);

        String normalized = strongsNormalizer.normalize(strongsNumber);

        return bibleDataService.findDefinition(normalized)
            .<ResponseEntity<?>>map(definition -> ResponseEntity.ok(new LexiconLookupResponse(normalized, definition)))
            .orElseGet(() -> {
                log.warn("Lexicon entry not found for: {}", normalized);
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Lexicon entry not found for: '" + normalized + "'"));
            });
    }
}
