package io.github.nicechester.logos.controller;

import io.github.nicechester.logos.model.VerseLookupRequest;
import io.github.nicechester.logos.model.VerseLookupResult;
import io.github.nicechester.logos.service.BibleDataService;
import io.github.nicechester.logos.service.VerseLookupService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for verse lookups.
 */
@Slf4j
@RestController
@RequestMapping("/api/verses")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class VersesController {

    private static final String VERSE_REFERENCES_PARAM = "verseReferences";

    private final VerseLookupService verseLookupService;
    private final BibleDataService bibleDataService;

    /**
     * Look up verses with morphology and lexicon data.
     * 
     * POST /api/verses/lookup
     * {
     *   "verseReferences": ["Matt 1:1", "John.3.16"]
     * }
     */
    @PostMapping("/lookup")
    public ResponseEntity<VerseLookupResult> lookupPost(@RequestBody VerseLookupRequest request) {
        log.info("POST verse lookup: references={}", request.verseReferences());

        VerseLookupResult result = verseLookupService.lookupVerses(request.verseReferences());
        log.info("Returning {} verses, {} not found", result.verses().size(), result.notFound().size());
        return ResponseEntity.ok(result);
    }

    /**
     * GET /api/verses/lookup?verseReferences=Matt 1:1&verseReferences=John 3:16
     *
     * <p>Each {@code verseReferences} value is one reference, even when it contains a comma.
     */
    @GetMapping("/lookup")
    public ResponseEntity<VerseLookupResult> lookupGet(@RequestParam MultiValueMap<String, String> params) {
        List<String> verseReferences = params.get(VERSE_REFERENCES_PARAM);

        log.info("GET verse lookup: references={}", verseReferences);

        VerseLookupResult result = verseLookupService.lookupVerses(verseReferences);
        log.info("Returning {} verses, {} not found", result.verses().size(), result.notFound().size());
        return ResponseEntity.ok(result);
    }

    /**
     * Health check with dataset status.
     * 
     * GET /api/verses/_health
     */
    @GetMapping("/_health")
    public ResponseEntity<Map<String, Object>> health() {
        log.debug("Health check requested");
        return ResponseEntity.ok(Map.of(
            "status", "Healthy",
            "initialized", bibleDataService.isInitialized(),
            "versesCount", bibleDataService.getVersesCount(),
            "lexiconCount", bibleDataService.getLexiconCount()
        ));
    }
}
