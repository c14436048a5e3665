package io.github.nicechester.logos.controller;

import io.github.nicechester.logos.model.MorphologyInfo;
import io.github.nicechester.logos.parser.RmacParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * REST controller for decoding RMAC codes on their own.
 */
@Slf4j
@RestController
@RequestMapping("/api/morphology")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class MorphologyController {

    private final RmacParser rmacParser;

    /**
     * GET /api/morphology/V-AAI-3S
     */
    @GetMapping("/{code}")
    public ResponseEntity<?> parse(@PathVariable String code) {
        Optional<MorphologyInfo> morphology = rmacParser.parse(code);
        if (morphology.isEmpty()) {
            log.warn("Unparseable RMAC code: {}", code);
            return ResponseEntity.badRequest()
                .body(Map.of("error", "Invalid RMAC code: '" + code + "'"));
        }
        return ResponseEntity.ok(morphology.get());
    }
}
