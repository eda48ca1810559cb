package com.mtg.decksync.remote;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(500), sleeps::add);

    @Test
    void testBackoffDoubles() {
        assertEquals(Duration.ofMillis(500), policy.delayFor(1));
        assertEquals(Duration.ofMillis(1000), policy.delayFor(2));
        assertEquals(Duration.ofMillis(2000), policy.delayFor(3));
    }

    @Test
    void testSucceedsAfterTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute("op", true, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientException("busy", 503);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(1000)), sleeps);
    }

    @Test
    void testGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientException.class, () -> policy.execute("op", true, () -> {
            calls.incrementAndGet();
            throw new TransientException("busy", 429);
        }));
        assertEquals(3, calls.get());
    }

    @Test
    void testNonTransientFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(AuthException.class, () -> policy.execute("op", true, () -> {
            calls.incrementAndGet();
            throw new AuthException("expired", 401);
        }));
        assertThrows(ProtocolException.class, () -> policy.execute("op", true, () -> {
            calls.incrementAndGet();
            throw new ProtocolException("bad body");
        }));
        assertEquals(2, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testWriteRetriedWhenServerAnswered() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        policy.execute("create", false, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientException("rate limited", 429);
            }
            return null;
        });

        assertEquals(2, calls.get());
    }

    @Test
    void testWriteNotRetriedWithoutResponse() {
        AtomicInteger calls = new AtomicInteger();

        TransientException e = assertThrows(TransientException.class, () -> policy.execute("create", false, () -> {
            calls.incrementAndGet();
            throw new TransientException("timed out", new IOException("timeout"));
        }));

        assertTrue(e.isNoResponse());
        assertEquals(1, calls.get());
    }

    @Test
    void testReadRetriedWithoutResponse() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        policy.execute("fetch", true, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientException("reset", new IOException("connection reset"));
            }
            return null;
        });

        assertEquals(2, calls.get());
    }

    @Test
    void testNoRetryPolicy() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransientException.class, () -> RetryPolicy.noRetry().execute("op", true, () -> {
            calls.incrementAndGet();
            throw new TransientException("busy", 503);
        }));
        assertEquals(1, calls.get());
    }

    @Test
    void testRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, Duration.ZERO, d -> {}));
    }
}
