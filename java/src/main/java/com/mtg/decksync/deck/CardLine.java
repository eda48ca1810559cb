package com.mtg.decksync.deck;

import java.util.Objects;

/**
 * One entry of a deck list: "N Card Name" on a given board.
 */
public record CardLine(String name, int quantity, Board board) {

    public CardLine {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(board, "board");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Card name cannot be blank");
        }
        if (quantity < 1) {
            throw new IllegalArgumentException("Quantity must be at least 1 for " + name + ": " + quantity);
        }
    }

    public static CardLine main(int quantity, String name) {
        return new CardLine(name, quantity, Board.MAIN);
    }

    public static CardLine commander(String name) {
        return new CardLine(name, 1, Board.COMMANDER);
    }

    /**
     * Import/decklist form, e.g. "4 Island".
     */
    public String toDeckLine() {
        return quantity + " " + name;
    }
}
