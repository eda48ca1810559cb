package com.mtg.decksync.remote;

/**
 * Timeout, transport error, 429 or 5xx. Eligible for retry.
 */
public class TransientException extends RemoteException {
    private final boolean noResponse;

    /**
     * A response with a retryable status came back. Whether the request was
     * applied is unknown.
     */
    public TransientException(String message, int statusCode) {
        super(message, statusCode, null);
        this.noResponse = false;
    }

    /**
     * No response was received, so a write may or may not have been applied.
     */
    public TransientException(String message, Throwable cause) {
        super(message, -1, cause);
        this.noResponse = true;
    }

    public boolean isNoResponse() {
        return noResponse;
    }
}
