package com.mtg.decksync.deck;

/**
 * Thrown when a deck document cannot be turned into a {@link DeckRecord}.
 */
public class MalformedDeckException extends Exception {
    public MalformedDeckException(String message) {
        super(message);
    }

    public MalformedDeckException(String message, Throwable cause) {
        super(message, cause);
    }
}
