package io.github.nicechester.logos.parser;

import lombok.Getter;

/**
 * Thrown by {@link VerseReferenceNormalizer#normalize(String)} when a reference does not match
 * the accepted shape or names an unknown book.
 */
@Getter
public class InvalidVerseReferenceException extends IllegalArgumentException {

    private final String input;

    public InvalidVerseReferenceException(String input) {
        super("Invalid verse reference: '" + input + "'");
        this.input = input;
    }
}
