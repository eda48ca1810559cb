package com.mtg.decksync.remote;

import com.mtg.decksync.deck.CardLine;
import com.mtg.decksync.deck.Visibility;

import java.util.List;

/**
 * Operations the sync engine needs from the deck host.
 * <p>
 * The host offers no way to delete a deck, remove a card or change a quantity.
 * {@link #importCards} only ever adds.
 */
public interface RemoteDecks {

    /**
     * All decks owned by {@code owner}, across every page.
     */
    List<RemoteDeckSummary> listOwnedDecks(String owner) throws RemoteException;

    /**
     * Full deck by public id.
     *
     * @throws NotFoundException if the id no longer resolves
     */
    RemoteDeckSnapshot fetchDeck(String remoteId) throws RemoteException;

    /**
     * Create an empty deck. {@code visibility} must be discoverable, otherwise the
     * deck could never be found again through {@link #listOwnedDecks}.
     * The returned ref may lack the internal id; {@link #importCards} resolves it.
     */
    RemoteDeckRef createDeck(String name, String format, Visibility visibility) throws RemoteException;

    /**
     * Append card lines to a deck. Not idempotent: importing the same lines twice
     * doubles their quantities.
     *
     * @return the deck as it stands after the import
     */
    RemoteDeckSnapshot importCards(RemoteDeckRef deck, List<CardLine> lines) throws RemoteException;
}
