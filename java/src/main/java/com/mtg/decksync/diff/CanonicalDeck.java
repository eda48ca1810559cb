package com.mtg.decksync.diff;

import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.DeckRecord;
import com.mtg.decksync.remote.RemoteCardEntry;
import com.mtg.decksync.remote.RemoteDeckSnapshot;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A card list reduced to one summed quantity per (board, card name).
 * Names compare case-insensitively; line order and remote card ids are dropped.
 */
public final class CanonicalDeck {
    private final Map<Board, Map<String, Integer>> counts;
    private final Map<String, String> displayNames;

    private CanonicalDeck(Map<Board, Map<String, Integer>> counts, Map<String, String> displayNames) {
        this.counts = counts;
        this.displayNames = displayNames;
    }

    public static CanonicalDeck of(DeckRecord record) {
        Builder builder = new Builder();
        for (CardLine line : record.cards()) {
            builder.add(line.board(), line.name(), line.quantity());
        }
        return builder.build();
    }

    public static CanonicalDeck of(RemoteDeckSnapshot snapshot) {
        Builder builder = new Builder();
        for (Board board : Board.values()) {
            for (RemoteCardEntry entry : snapshot.entries(board)) {
                builder.add(board, entry.name(), entry.quantity());
            }
        }
        return builder.build();
    }

    /**
     * Summed quantities for a board, keyed by lower-cased card name, in sorted order.
     */
    public Map<String, Integer> board(Board board) {
        return Collections.unmodifiableMap(counts.get(board));
    }

    public int quantity(Board board, String cardName) {
        return counts.get(board).getOrDefault(key(cardName), 0);
    }

    /**
     * Card name as first written for the given key.
     */
    public String displayName(String key) {
        return displayNames.getOrDefault(key, key);
    }

    static String key(String cardName) {
        return cardName.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CanonicalDeck other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts);
    }

    @Override
    public String toString() {
        return counts.toString();
    }

    private static final class Builder {
        private final Map<Board, Map<String, Integer>> counts = new EnumMap<>(Board.class);
        private final Map<String, String> displayNames = new TreeMap<>();

        Builder() {
            for (Board board : Board.values()) {
                counts.put(board, new TreeMap<>());
            }
        }

        void add(Board board, String name, int quantity) {
            String key = key(name);
            counts.get(board).merge(key, quantity, Integer::sum);
            displayNames.putIfAbsent(key, name.trim());
        }

        CanonicalDeck build() {
            return new CanonicalDeck(counts, displayNames);
        }
    }
}
