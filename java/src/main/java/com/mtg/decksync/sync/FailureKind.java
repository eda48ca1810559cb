package com.mtg.decksync.sync;

import com.mtg.decksync.remote.AuthException;
import com.mtg.decksync.remote.ConflictException;
import com.mtg.decksync.remote.NotFoundException;
import com.mtg.decksync.remote.RemoteException;
import com.mtg.decksync.remote.TransientException;

/**
 * Why a deck failed to sync. {@link #AUTH} aborts the rest of a batch.
 */
public enum FailureKind {
    NONE,
    MALFORMED_DECK,
    AUTH,
    NOT_FOUND,
    TRANSIENT,
    PROTOCOL,
    CONFLICT,
    LOCAL_IO;

    public static FailureKind of(RemoteException e) {
        if (e instanceof AuthException) {
            return AUTH;
        }
        if (e instanceof NotFoundException) {
            return NOT_FOUND;
        }
        if (e instanceof TransientException) {
            return TRANSIENT;
        }
        if (e instanceof ConflictException) {
            return CONFLICT;
        }
        return PROTOCOL;
    }
}
