package com.mtg.decksync.deck;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Deck boards that take part in synchronization.
 * The JSON value is the board key Moxfield uses in deck payloads.
 */
public enum Board {
    COMMANDER("commanders"),
    MAIN("mainboard");

    private final String jsonValue;

    Board(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }
}
