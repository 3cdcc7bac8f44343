package com.mimecast.courier.feishu;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TokenCache.
 */
class TokenCacheTest {

    @Test
    void testTokenCachedUntilEarlyExpiry() throws Exception {
        MutableClock clock = new MutableClock();
        AtomicInteger fetches = new AtomicInteger();
        TokenCache cache = new TokenCache(() -> new TokenCache.AccessToken("t" + fetches.incrementAndGet(), 7200), clock);

        assertEquals("t1", cache.getToken());
        clock.advance(6899);
        assertEquals("t1", cache.getToken());
        assertEquals(1, fetches.get());

        clock.advance(1);
        assertEquals("t2", cache.getToken());
        assertEquals(2, fetches.get());
    }

    @Test
    void testShortLivedTokenAlwaysRefreshed() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        TokenCache cache = new TokenCache(() -> new TokenCache.AccessToken("t" + fetches.incrementAndGet(), 100), new MutableClock());

        cache.getToken();
        cache.getToken();
        assertEquals(2, fetches.get());
    }

    @Test
    void testRefreshedTokenCarriesItsOwnExpiry() throws Exception {
        MutableClock clock = new MutableClock();
        AtomicInteger fetches = new AtomicInteger();
        TokenCache cache = new TokenCache(() -> {
            int n = fetches.incrementAndGet();
            return new TokenCache.AccessToken("t" + n, n == 1 ? 7200 : 400);
        }, clock);

        assertEquals("t1", cache.getToken());
        clock.advance(6900);
        assertEquals("t2", cache.getToken());
        clock.advance(99);
        assertEquals("t2", cache.getToken());
        clock.advance(1);
        assertEquals("t3", cache.getToken());
        assertEquals(3, fetches.get());
    }

    @Test
    void testInvalidate() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        TokenCache cache = new TokenCache(() -> new TokenCache.AccessToken("t" + fetches.incrementAndGet(), 7200), new MutableClock());

        cache.getToken();
        cache.invalidate();
        assertEquals("t2", cache.getToken());
    }

    @Test
    void testFetchFailurePropagatesAndRetries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        TokenCache cache = new TokenCache(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new RemoteApiException("Failed to get tenant access token: code=10003");
            }
            return new TokenCache.AccessToken("ok", 7200);
        }, new MutableClock());

        assertThrows(RemoteApiException.class, cache::getToken);
        assertEquals("ok", cache.getToken());
    }

    @Test
    void testConcurrentCallersShareRefresh() throws Exception {
        AtomicInteger fetches = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        TokenCache cache = new TokenCache(() -> {
            fetches.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new TokenCache.AccessToken("shared", 7200);
        }, new MutableClock());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> {
                    assertEquals("shared", cache.getToken());
                    return null;
                });
            }
            Thread.sleep(100);
            release.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, fetches.get());
    }

    /**
     * Clock advanced by hand.
     */
    private static class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(long seconds) {
            now = now.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
