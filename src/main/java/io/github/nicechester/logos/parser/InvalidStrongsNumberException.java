package io.github.nicechester.logos.parser;

import lombok.Getter;

/**
 * Thrown by {@link StrongsNumberNormalizer#normalize(String)} for input that is not a
 * G- or H-prefixed Strong's number.
 */
@Getter
public class InvalidStrongsNumberException extends IllegalArgumentException {

    private final String input;

    public InvalidStrongsNumberException(String input) {
        super("Invalid Strong's number: '" + input + "'");
        this.input = input;
    }
}
