package com.mtg.decksync.diff;

import com.mtg.decksync.deck.Board;
import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.DeckMetadata;
import com.mtg.decksync.deck.DeckRecord;
import com.mtg.decksync.remote.RemoteCardEntry;
import com.mtg.decksync.remote.RemoteDeckSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for local/remote deck comparison.
 */
class DeckDiffTest {

    private static DeckRecord local(CardLine... lines) {
        return new DeckRecord("Deck", List.of(lines), DeckMetadata.unlinked("Deck"), "");
    }

    private static RemoteDeckSnapshot remote(CardLine... lines) {
        Map<Board, List<RemoteCardEntry>> boards = new EnumMap<>(Board.class);
        int uid = 0;
        for (CardLine line : lines) {
            boards.computeIfAbsent(line.board(), b -> new ArrayList<>())
                    .add(new RemoteCardEntry("u" + (++uid), line.name(), line.quantity()));
        }
        return new RemoteDeckSnapshot("X9", "abc", "Deck", "1", boards);
    }

    @Test
    void testIdenticalDecksAreEquivalent() {
        DeckRecord deck = local(CardLine.commander("Hakbal of the Surging Soul"), CardLine.main(1, "Sol Ring"));
        RemoteDeckSnapshot snapshot = remote(CardLine.commander("Hakbal of the Surging Soul"), CardLine.main(1, "Sol Ring"));

        assertTrue(DeckDiff.equivalent(deck, snapshot));
        assertTrue(DeckDiff.compare(deck, snapshot).isEmpty());
    }

    @Test
    void testOrderDoesNotMatter() {
        DeckRecord deck = local(CardLine.main(1, "Sol Ring"), CardLine.main(1, "Arcane Signet"));
        RemoteDeckSnapshot snapshot = remote(CardLine.main(1, "Arcane Signet"), CardLine.main(1, "Sol Ring"));

        assertTrue(DeckDiff.equivalent(deck, snapshot));
    }

    @Test
    void testSplitBasicLandsAreSummed() {
        DeckRecord deck = local(CardLine.main(10, "Island"), CardLine.main(1, "Sol Ring"), CardLine.main(5, "Island"));
        RemoteDeckSnapshot snapshot = remote(CardLine.main(15, "Island"), CardLine.main(1, "Sol Ring"));

        assertTrue(DeckDiff.equivalent(deck, snapshot));
    }

    @Test
    void testNamesCompareCaseInsensitively() {
        assertTrue(DeckDiff.equivalent(local(CardLine.main(1, "sol ring")), remote(CardLine.main(1, "Sol Ring"))));
    }

    @Test
    void testAddedCard() {
        DeckRecord deck = local(CardLine.main(1, "Sol Ring"), CardLine.main(1, "Arcane Signet"));
        RemoteDeckSnapshot snapshot = remote(CardLine.main(1, "Sol Ring"));

        List<CardChange> changes = DeckDiff.compare(deck, snapshot);

        assertFalse(DeckDiff.equivalent(deck, snapshot));
        assertEquals(List.of(new CardChange(Board.MAIN, "Arcane Signet", 1, 0)), changes);
        assertEquals("+1 Arcane Signet", changes.get(0).toString());
    }

    @Test
    void testRemovedCardKeepsRemoteName() {
        List<CardChange> changes = DeckDiff.compare(
                local(CardLine.main(1, "Sol Ring")),
                remote(CardLine.main(1, "Sol Ring"), CardLine.main(1, "Mana Crypt")));

        assertEquals(1, changes.size());
        assertEquals("Mana Crypt", changes.get(0).name());
        assertEquals(-1, changes.get(0).delta());
        assertEquals("-1 Mana Crypt", changes.get(0).toString());
    }

    @Test
    void testQuantityChange() {
        List<CardChange> changes = DeckDiff.compare(local(CardLine.main(30, "Island")), remote(CardLine.main(29, "Island")));

        assertEquals(List.of(new CardChange(Board.MAIN, "Island", 30, 29)), changes);
    }

    @Test
    void testBoardMatters() {
        DeckRecord deck = local(CardLine.commander("Hakbal of the Surging Soul"));
        RemoteDeckSnapshot snapshot = remote(CardLine.main(1, "Hakbal of the Surging Soul"));

        List<CardChange> changes = DeckDiff.compare(deck, snapshot);

        assertFalse(DeckDiff.equivalent(deck, snapshot));
        assertEquals(2, changes.size());
        assertEquals(Board.COMMANDER, changes.get(0).board());
        assertEquals("+1 Hakbal of the Surging Soul (commander)", changes.get(0).toString());
        assertEquals(Board.MAIN, changes.get(1).board());
    }

    @Test
    void testChangesSortedByBoardThenName() {
        List<CardChange> changes = DeckDiff.compare(
                local(CardLine.main(1, "Zuran Orb"), CardLine.main(1, "Arcane Signet"), CardLine.commander("Tymna the Weaver")),
                remote(CardLine.main(1, "Mana Crypt")));

        assertEquals(List.of("Tymna the Weaver", "Arcane Signet", "Mana Crypt", "Zuran Orb"),
                changes.stream().map(CardChange::name).toList());
    }

    @Test
    void testCanonicalDeckQuantities() {
        CanonicalDeck deck = CanonicalDeck.of(local(CardLine.main(2, "Island"), CardLine.main(3, "island")));

        assertEquals(5, deck.quantity(Board.MAIN, "ISLAND"));
        assertEquals(0, deck.quantity(Board.COMMANDER, "Island"));
        assertEquals("Island", deck.displayName("island"));
        assertEquals(Map.of("island", 5), deck.board(Board.MAIN));
    }

    @Test
    void testEmptyRemoteDiffersFromAnyLocalDeck() {
        RemoteDeckSnapshot empty = remote();

        assertTrue(empty.isEmpty());
        assertFalse(DeckDiff.equivalent(local(CardLine.main(1, "Sol Ring")), empty));
    }
}
