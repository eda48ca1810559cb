package com.mtg.decksync.deck;

import java.util.Objects;

/**
 * Local record of a deck's link to Moxfield.
 *
 * @param remoteId    Moxfield public id, null until the first sync
 * @param displayName name the remote deck is created with
 * @param visibility  last visibility requested for the remote deck
 */
public record DeckMetadata(String remoteId, String displayName, Visibility visibility) {

    public DeckMetadata {
        Objects.requireNonNull(displayName, "displayName");
        Objects.requireNonNull(visibility, "visibility");
    }

    public static DeckMetadata unlinked(String displayName) {
        return new DeckMetadata(null, displayName, Visibility.discoverable());
    }

    public boolean isLinked() {
        return remoteId != null;
    }

    public DeckMetadata linkedTo(String newRemoteId, Visibility newVisibility) {
        return new DeckMetadata(Objects.requireNonNull(newRemoteId, "newRemoteId"), displayName, newVisibility);
    }
}
