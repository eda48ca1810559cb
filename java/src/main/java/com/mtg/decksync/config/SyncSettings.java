package com.mtg.decksync.config;

import com.mtg.decksync.remote.RemoteClientConfig;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Settings for one run, resolved from a {@code .env} file and the process
 * environment (the environment wins). Read once, at startup.
 *
 * @param bearerToken Moxfield bearer token, null when not configured
 * @param username    Moxfield user whose decks are listed and pulled
 * @param client      endpoint and transport settings
 */
public record SyncSettings(String bearerToken, String username, RemoteClientConfig client) {

    public static final String TOKEN_VAR = "MOXFIELD_BEARER_TOKEN";
    public static final String USERNAME_VAR = "MOXFIELD_USERNAME";
    public static final String API_BASE_VAR = "MOXFIELD_API_BASE";
    public static final String WEB_BASE_VAR = "MOXFIELD_WEB_BASE";
    public static final String VERSION_VAR = "MOXFIELD_VERSION";
    public static final String TIMEOUT_VAR = "MOXFIELD_TIMEOUT_SECONDS";

    public static SyncSettings load(Path envFile) throws ConfigException {
        Map<String, String> values = new HashMap<>(EnvFile.read(envFile));
        values.putAll(System.getenv());
        return from(values);
    }

    static SyncSettings from(Map<String, String> values) throws ConfigException {
        RemoteClientConfig defaults = RemoteClientConfig.defaults();

        URI apiBase = uri(values, API_BASE_VAR, defaults.apiBase());
        URI webBase = uri(values, WEB_BASE_VAR, defaults.webBase());
        String version = blankToNull(values.get(VERSION_VAR));

        Duration timeout = defaults.requestTimeout();
        String timeoutValue = blankToNull(values.get(TIMEOUT_VAR));
        if (timeoutValue != null) {
            try {
                timeout = Duration.ofSeconds(Long.parseLong(timeoutValue));
            } catch (NumberFormatException e) {
                throw new ConfigException(TIMEOUT_VAR + " must be a number of seconds: " + timeoutValue, e);
            }
            if (timeout.getSeconds() < 1) {
                throw new ConfigException(TIMEOUT_VAR + " must be at least 1 second: " + timeoutValue);
            }
        }

        RemoteClientConfig client = new RemoteClientConfig(apiBase, webBase,
                version == null ? defaults.clientVersion() : version,
                timeout, timeout.multipliedBy(2), defaults.pageSize());
        return new SyncSettings(blankToNull(values.get(TOKEN_VAR)), blankToNull(values.get(USERNAME_VAR)), client);
    }

    /**
     * @throws ConfigException with instructions for getting a token when none is set
     */
    public String requireToken() throws ConfigException {
        if (bearerToken == null) {
            throw new ConfigException(TOKEN_VAR + " not set.\n"
                    + "To get a fresh token:\n"
                    + "  1. Open moxfield.com, press F12 and open the Network tab\n"
                    + "  2. Trigger any request to api2.moxfield.com\n"
                    + "  3. Copy the Authorization header value (after \"Bearer \")\n"
                    + "  4. Put " + TOKEN_VAR + "=<token> in .env");
        }
        return bearerToken;
    }

    public String requireUsername() throws ConfigException {
        if (username == null) {
            throw new ConfigException(USERNAME_VAR + " not set. Add " + USERNAME_VAR + "=<your Moxfield user> to .env");
        }
        return username;
    }

    @Override
    public String toString() {
        return "SyncSettings[bearerToken=" + (bearerToken == null ? "unset" : "***")
                + ", username=" + username + ", apiBase=" + client.apiBase() + "]";
    }

    private static URI uri(Map<String, String> values, String key, URI fallback) throws ConfigException {
        String value = blankToNull(values.get(key));
        if (value == null) {
            return fallback;
        }
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigException(key + " is not a valid URI: " + value, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
