package com.mtg.decksync.deck;

import java.util.List;
import java.util.Objects;

/**
 * A locally authored deck: card lines in file order, the Moxfield link
 * metadata, and the document it was parsed from.
 * <p>
 * The sync engine only ever replaces {@link #metadata()}; card lines are owned
 * by whoever edits the file.
 */
public record DeckRecord(String title, List<CardLine> cards, DeckMetadata metadata, String document) {

    public DeckRecord {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(document, "document");
        cards = List.copyOf(cards);
        if (cards.isEmpty()) {
            throw new IllegalArgumentException("Deck must contain at least one card line");
        }
    }

    public DeckRecord withMetadata(DeckMetadata newMetadata) {
        return new DeckRecord(title, cards, newMetadata, document);
    }

    public List<CardLine> linesFor(Board board) {
        return cards.stream().filter(c -> c.board() == board).toList();
    }

    public int totalCards() {
        return cards.stream().mapToInt(CardLine::quantity).sum();
    }

    public String displayName() {
        return metadata.displayName();
    }
}
