package com.mtg.decksync.remote;

/**
 * Entry of an owner's deck listing.
 */
public record RemoteDeckSummary(String publicId, String name, String format, String visibility) {}
