package com.mtg.decksync.sync;

import java.util.Objects;

/**
 * Result of syncing one deck.
 *
 * @param deck             deck label, usually the file name
 * @param state            final state
 * @param partial          the remote deck was created but its cards were not imported
 * @param remoteId         remote id now linked (or created, for failures after creation)
 * @param orphanedRemoteId previously linked remote deck that is no longer referenced
 * @param failure          failure kind, {@link FailureKind#NONE} on success
 * @param error            error detail, null on success
 * @param nextAction       what the operator should do next, null when nothing
 */
public record SyncOutcome(String deck,
                          SyncState state,
                          boolean partial,
                          String remoteId,
                          String orphanedRemoteId,
                          FailureKind failure,
                          String error,
                          String nextAction) {

    public SyncOutcome {
        Objects.requireNonNull(deck, "deck");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(failure, "failure");
    }

    public static SyncOutcome created(String deck, String remoteId) {
        return new SyncOutcome(deck, SyncState.CREATED, false, remoteId, null, FailureKind.NONE, null, null);
    }

    public static SyncOutcome unchanged(String deck, String remoteId) {
        return new SyncOutcome(deck, SyncState.UNCHANGED, false, remoteId, null, FailureKind.NONE, null, null);
    }

    public static SyncOutcome superseded(String deck, String remoteId, String orphanedRemoteId) {
        return new SyncOutcome(deck, SyncState.SUPERSEDED, false, remoteId, orphanedRemoteId, FailureKind.NONE,
                null, "delete orphaned Moxfield deck " + orphanedRemoteId + " by hand if it is no longer wanted");
    }

    public static SyncOutcome failed(String deck, FailureKind failure, String error, String nextAction) {
        return new SyncOutcome(deck, SyncState.FAILED, false, null, null, failure, error, nextAction);
    }

    /**
     * Failure after the remote deck was created: the new id is already linked locally.
     */
    public static SyncOutcome partial(String deck, FailureKind failure, String remoteId, String orphanedRemoteId,
                                      String error, String nextAction) {
        return new SyncOutcome(deck, SyncState.FAILED, true, remoteId, orphanedRemoteId, failure, error, nextAction);
    }

    public boolean isSuccess() {
        return state.isSuccess();
    }

    public String summaryLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(isSuccess() ? "✓ " : "✗ ");
        sb.append(String.format("%-32s %-10s", deck, partial ? "PARTIAL" : state.name()));
        if (remoteId != null) {
            sb.append(" id=").append(remoteId);
        }
        if (orphanedRemoteId != null) {
            sb.append(" orphaned=").append(orphanedRemoteId);
        }
        if (error != null) {
            sb.append("\n    error: ").append(error);
        }
        if (nextAction != null) {
            sb.append("\n    next:  ").append(nextAction);
        }
        return sb.toString();
    }
}
