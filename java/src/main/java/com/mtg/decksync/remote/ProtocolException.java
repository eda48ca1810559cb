package com.mtg.decksync.remote;

/**
 * Unexpected status or a response body that does not have the expected shape.
 */
public class ProtocolException extends RemoteException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, int statusCode) {
        super(message, statusCode, null);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
