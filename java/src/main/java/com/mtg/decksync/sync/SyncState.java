package com.mtg.decksync.sync;

/**
 * Final state of one reconciliation attempt.
 */
public enum SyncState {
    /** First publish: a remote deck was created and filled. */
    CREATED,
    /** Remote deck already matches; nothing was written. */
    UNCHANGED,
    /** Local deck changed; a new remote deck replaced the linked one. */
    SUPERSEDED,
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }
}
