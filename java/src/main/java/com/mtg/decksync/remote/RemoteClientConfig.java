package com.mtg.decksync.remote;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Endpoint and transport settings for {@link MoxfieldClient}.
 *
 * @param apiBase        API root, e.g. {@code https://api2.moxfield.com}
 * @param webBase        web app origin sent as Origin/Referer
 * @param clientVersion  value of the {@code x-moxfield-version} header the web app sends
 * @param requestTimeout per-request timeout
 * @param importTimeout  timeout for the import call, which is slower
 * @param pageSize       page size for deck listings
 */
public record RemoteClientConfig(URI apiBase,
                                 URI webBase,
                                 String clientVersion,
                                 Duration requestTimeout,
                                 Duration importTimeout,
                                 int pageSize) {

    public static final URI DEFAULT_API_BASE = URI.create("https://api2.moxfield.com");
    public static final URI DEFAULT_WEB_BASE = URI.create("https://moxfield.com");
    public static final String DEFAULT_CLIENT_VERSION = "2026.02.16.1";

    public RemoteClientConfig {
        Objects.requireNonNull(apiBase, "apiBase");
        Objects.requireNonNull(webBase, "webBase");
        Objects.requireNonNull(clientVersion, "clientVersion");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(importTimeout, "importTimeout");
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
    }

    public static RemoteClientConfig defaults() {
        return forBase(DEFAULT_API_BASE);
    }

    public static RemoteClientConfig forBase(URI apiBase) {
        return new RemoteClientConfig(apiBase, DEFAULT_WEB_BASE, DEFAULT_CLIENT_VERSION,
                Duration.ofSeconds(15), Duration.ofSeconds(30), 100);
    }
}
