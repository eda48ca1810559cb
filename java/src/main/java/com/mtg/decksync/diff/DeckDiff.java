package com.mtg.decksync.diff;

import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.DeckRecord;
import com.mtg.decksync.remote.RemoteDeckSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Compares a local deck with a remote snapshot.
 * Both sides are reduced to {@link CanonicalDeck} first, so splitting a basic
 * land over several lines or reordering the list never counts as a change.
 */
public final class DeckDiff {
    private DeckDiff() {}

    public static boolean equivalent(DeckRecord local, RemoteDeckSnapshot remote) {
        return CanonicalDeck.of(local).equals(CanonicalDeck.of(remote));
    }

    /**
     * Every (board, card) whose quantity differs, ordered by board then name.
     * Empty exactly when {@link #equivalent} is true.
     */
    public static List<CardChange> compare(DeckRecord local, RemoteDeckSnapshot remote) {
        CanonicalDeck localDeck = CanonicalDeck.of(local);
        CanonicalDeck remoteDeck = CanonicalDeck.of(remote);

        List<CardChange> changes = new ArrayList<>();
        for (Board board : Board.values()) {
            Map<String, Integer> localBoard = localDeck.board(board);
            Map<String, Integer> remoteBoard = remoteDeck.board(board);
            TreeSet<String> keys = new TreeSet<>(localBoard.keySet());
            keys.addAll(remoteBoard.keySet());
            for (String key : keys) {
                int localQty = localBoard.getOrDefault(key, 0);
                int remoteQty = remoteBoard.getOrDefault(key, 0);
                if (localQty != remoteQty) {
                    String name = localQty > 0 ? localDeck.displayName(key) : remoteDeck.displayName(key);
                    changes.add(new CardChange(board, name, localQty, remoteQty));
                }
            }
        }
        return changes;
    }
}
