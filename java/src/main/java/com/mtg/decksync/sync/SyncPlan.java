package com.mtg.decksync.sync;

import com.mtg.decksync.diff.CardChange;

import java.util.List;

/**
 * What a sync would do for a deck, computed without writing anything.
 */
public record SyncPlan(String deck, Action action, String displayName, String remoteId,
                       int totalCards, List<CardChange> changes, String error) {

    public enum Action {
        CREATE,
        UNCHANGED,
        SUPERSEDE,
        FAILED
    }

    public SyncPlan {
        changes = List.copyOf(changes);
    }
}
