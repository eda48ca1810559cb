package com.mtg.decksync.deck;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Remote deck visibility.
 * Only {@link #PUBLIC} decks show up in the owner's deck listing, so it is the
 * only value the sync engine ever requests.
 */
public enum Visibility {
    PUBLIC("public"),
    UNLISTED("unlisted"),
    PRIVATE("private");

    private final String jsonValue;

    Visibility(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public boolean isDiscoverable() {
        return this == PUBLIC;
    }

    public static Visibility discoverable() {
        return PUBLIC;
    }

    public static Visibility fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Visibility cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "public" -> PUBLIC;
            case "unlisted" -> UNLISTED;
            case "private" -> PRIVATE;
            default -> throw new IllegalArgumentException("Unknown visibility: " + value);
        };
    }
}
