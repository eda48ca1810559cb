package com.mtg.decksync.remote;

/**
 * Optimistic-concurrency version mismatch (409/412). The sync policy never
 * updates a deck in place, so this only surfaces if the server rejects a write
 * for concurrency reasons anyway.
 */
public class ConflictException extends RemoteException {
    public ConflictException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
