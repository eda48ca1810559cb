package com.mtg.decksync.remote;

import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.CardLine;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Moxfield's current view of a deck.
 *
 * @param remoteId     public id
 * @param internalId   internal id, used for imports
 * @param name         deck name
 * @param versionToken optimistic-concurrency version, echoed on in-place writes
 * @param boards       card entries of the synchronized boards
 */
public record RemoteDeckSnapshot(String remoteId,
                                 String internalId,
                                 String name,
                                 String versionToken,
                                 Map<Board, List<RemoteCardEntry>> boards) {

    public RemoteDeckSnapshot {
        Map<Board, List<RemoteCardEntry>> copy = new EnumMap<>(Board.class);
        for (Board board : Board.values()) {
            copy.put(board, List.copyOf(boards.getOrDefault(board, List.of())));
        }
        boards = copy;
    }

    public List<RemoteCardEntry> entries(Board board) {
        return boards.get(board);
    }

    public int totalCards() {
        return boards.values().stream()
                .flatMap(List::stream)
                .mapToInt(RemoteCardEntry::quantity)
                .sum();
    }

    public boolean isEmpty() {
        return totalCards() == 0;
    }

    public RemoteDeckRef ref() {
        return new RemoteDeckRef(remoteId, internalId);
    }

    /**
     * Card lines as a local decklist would hold them, commander board first.
     */
    public List<CardLine> toCardLines() {
        List<CardLine> lines = new ArrayList<>();
        for (Board board : List.of(Board.COMMANDER, Board.MAIN)) {
            for (RemoteCardEntry entry : entries(board)) {
                lines.add(new CardLine(entry.name(), entry.quantity(), board));
            }
        }
        return lines;
    }
}
