package com.mtg.decksync.remote;

import java.util.Objects;

/**
 * Both ids of a remote deck. The public id appears in URLs and is what local
 * metadata stores; the internal id is required by the import endpoint and is
 * null when the create response did not include it.
 */
public record RemoteDeckRef(String publicId, String internalId) {
    public RemoteDeckRef {
        Objects.requireNonNull(publicId, "publicId");
    }
}
