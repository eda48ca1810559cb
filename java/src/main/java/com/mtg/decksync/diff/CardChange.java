package com.mtg.decksync.diff;

import com.mtg.decksync.deck.Board;

/**
 * Quantity difference for one card between the local and remote deck.
 */
public record CardChange(Board board, String name, int localQuantity, int remoteQuantity) {

    public int delta() {
        return localQuantity - remoteQuantity;
    }

    @Override
    public String toString() {
        int delta = delta();
        String sign = delta > 0 ? "+" : "";
        String where = board == Board.COMMANDER ? " (commander)" : "";
        return sign + delta + " " + name + where;
    }
}
