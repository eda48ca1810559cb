package com.mtg.decksync.remote;

/**
 * 401/403: the bearer token is expired or invalid. Never retried; a fresh token
 * has to be extracted from a browser session.
 */
public class AuthException extends RemoteException {
    public AuthException(String message, int statusCode) {
        super(message, statusCode, null);
    }
}
