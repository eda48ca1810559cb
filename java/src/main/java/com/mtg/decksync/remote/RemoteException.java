package com.mtg.decksync.remote;

/**
 * Base class for failures talking to Moxfield.
 */
public class RemoteException extends Exception {
    private final int statusCode;

    public RemoteException(String message) {
        this(message, -1, null);
    }

    public RemoteException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public RemoteException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that caused the failure, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
