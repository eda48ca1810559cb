package com.mtg.decksync.remote;

/**
 * The requested deck id no longer resolves on Moxfield.
 */
public class NotFoundException extends RemoteException {
    private final String remoteId;

    public NotFoundException(String remoteId) {
        super("Deck " + remoteId + " not found on Moxfield", 404, null);
        this.remoteId = remoteId;
    }

    public String getRemoteId() {
        return remoteId;
    }
}
