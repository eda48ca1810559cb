package com.mtg.decksync.sync;

import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.Visibility;
import com.mtg.decksync.remote.NotFoundException;
import com.mtg.decksync.remote.RemoteCardEntry;
import com.mtg.decksync.remote.RemoteDeckRef;
import com.mtg.decksync.remote.RemoteDeckSnapshot;
import com.mtg.decksync.remote.RemoteDeckSummary;
import com.mtg.decksync.remote.RemoteDecks;
import com.mtg.decksync.remote.RemoteException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory Moxfield with the same write restrictions: create, additive
 * import, no delete.
 */
class FakeRemoteDecks implements RemoteDecks {

    static final class Deck {
        final String publicId;
        final String internalId;
        final String name;
        final Visibility visibility;
        final Map<Board, Map<String, Integer>> cards = new EnumMap<>(Board.class);

        Deck(String publicId, String internalId, String name, Visibility visibility) {
            this.publicId = publicId;
            this.internalId = internalId;
            this.name = name;
            this.visibility = visibility;
            for (Board board : Board.values()) {
                cards.put(board, new LinkedHashMap<>());
            }
        }
    }

    final Map<String, Deck> decks = new LinkedHashMap<>();
    final List<String> calls = new ArrayList<>();
    private final Deque<String> nextIds = new ArrayDeque<>();
    private final Deque<RemoteException> createFailures = new ArrayDeque<>();
    private final Deque<RemoteException> importFailures = new ArrayDeque<>();
    private RemoteException fetchFailure;
    private int counter;

    void nextId(String publicId) {
        nextIds.add(publicId);
    }

    void failNextCreate(RemoteException e) {
        createFailures.add(e);
    }

    void failNextImport(RemoteException e) {
        importFailures.add(e);
    }

    void failFetches(RemoteException e) {
        fetchFailure = e;
    }

    Deck put(String publicId, String name, CardLine... lines) {
        Deck deck = new Deck(publicId, "int-" + publicId, name, Visibility.PUBLIC);
        for (CardLine line : lines) {
            deck.cards.get(line.board()).merge(line.name(), line.quantity(), Integer::sum);
        }
        decks.put(publicId, deck);
        return deck;
    }

    long writes() {
        return calls.stream().filter(c -> c.startsWith("create") || c.startsWith("import")).count();
    }

    @Override
    public List<RemoteDeckSummary> listOwnedDecks(String owner) {
        calls.add("list " + owner);
        List<RemoteDeckSummary> summaries = new ArrayList<>();
        for (Deck deck : decks.values()) {
            summaries.add(new RemoteDeckSummary(deck.publicId, deck.name, "commander", deck.visibility.getJsonValue()));
        }
        return summaries;
    }

    @Override
    public RemoteDeckSnapshot fetchDeck(String remoteId) throws RemoteException {
        calls.add("fetch " + remoteId);
        if (fetchFailure != null) {
            throw fetchFailure;
        }
        Deck deck = decks.get(remoteId);
        if (deck == null) {
            throw new NotFoundException(remoteId);
        }
        return snapshot(deck);
    }

    @Override
    public RemoteDeckRef createDeck(String name, String format, Visibility visibility) throws RemoteException {
        calls.add("create " + name);
        if (!createFailures.isEmpty()) {
            throw createFailures.poll();
        }
        String publicId = nextIds.isEmpty() ? "new-" + (++counter) : nextIds.poll();
        Deck deck = new Deck(publicId, "int-" + publicId, name, visibility);
        decks.put(publicId, deck);
        return new RemoteDeckRef(publicId, deck.internalId);
    }

    @Override
    public RemoteDeckSnapshot importCards(RemoteDeckRef ref, List<CardLine> lines) throws RemoteException {
        calls.add("import " + ref.publicId());
        if (!importFailures.isEmpty()) {
            throw importFailures.poll();
        }
        Deck deck = decks.get(ref.publicId());
        if (deck == null) {
            throw new NotFoundException(ref.publicId());
        }
        for (CardLine line : lines) {
            deck.cards.get(line.board()).merge(line.name(), line.quantity(), Integer::sum);
        }
        return snapshot(deck);
    }

    private static RemoteDeckSnapshot snapshot(Deck deck) {
        Map<Board, List<RemoteCardEntry>> boards = new EnumMap<>(Board.class);
        int uid = 0;
        for (Map.Entry<Board, Map<String, Integer>> board : deck.cards.entrySet()) {
            List<RemoteCardEntry> entries = new ArrayList<>();
            for (Map.Entry<String, Integer> card : board.getValue().entrySet()) {
                entries.add(new RemoteCardEntry("u" + (++uid), card.getKey(), card.getValue()));
            }
            boards.put(board.getKey(), entries);
        }
        return new RemoteDeckSnapshot(deck.publicId, deck.internalId, deck.name, "1", boards);
    }
}
