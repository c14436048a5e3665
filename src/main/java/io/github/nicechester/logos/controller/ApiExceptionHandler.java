package io.github.nicechester.logos.controller;

import io.github.nicechester.logos.parser.InvalidStrongsNumberException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps a rejected Strong's number to a 400 response with an {@code error} message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidStrongsNumberException.class)
    public ResponseEntity<Map<String, String>> handleInvalidStrongsNumber(InvalidStrongsNumberException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
