package com.mtg.decksync.remote;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Bounded exponential backoff for {@link TransientException}s.
 * <p>
 * Calls that are not idempotent are retried only when a response with status
 * 429 or 5xx came back, and never after a timeout or dropped connection. A 5xx
 * from the edge layer still does not prove the write was not applied, so a
 * retried create or import can in rare cases duplicate a deck or double an
 * import.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(500);

    @FunctionalInterface
    public interface RemoteCall<T> {
        T call() throws RemoteException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = sleeper;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, d -> Thread.sleep(d.toMillis()));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, d -> {});
    }

    public <T> T execute(String operation, boolean idempotent, RemoteCall<T> call) throws RemoteException {
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (TransientException e) {
                boolean retryable = idempotent || !e.isNoResponse();
                if (!retryable || attempt >= maxAttempts || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                Duration delay = delayFor(attempt);
                log.warn("{} failed (attempt {}/{}): {} - retrying in {} ms",
                        operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
                attempt++;
            }
        }
    }

    Duration delayFor(int attempt) {
        return baseDelay.multipliedBy(1L << (attempt - 1));
    }
}
