package com.mtg.decksync.remote;

/**
 * One card line of a remote board, keyed by the server-assigned id.
 */
public record RemoteCardEntry(String uniqueCardId, String name, int quantity) {}
