package com.mimecast.courier.feishu;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tenant access token cache.
 *
 * <p>Holds a single token and refreshes it through the given fetcher once expired.
 * <br>Tokens are considered expired {@link #EARLY_EXPIRY_SECONDS} before the platform says so.
 * <p>Refresh is serialized by a lock so concurrent callers share one fetch.
 */
public class TokenCache {
    private static final Logger log = LogManager.getLogger(TokenCache.class);

    /**
     * Seconds subtracted from the advertised lifetime.
     */
    public static final long EARLY_EXPIRY_SECONDS = 300;

    private final TokenFetcher fetcher;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile CachedToken cached;

    /**
     * Constructs a new TokenCache instance using the system clock.
     *
     * @param fetcher TokenFetcher instance.
     */
    public TokenCache(TokenFetcher fetcher) {
        this(fetcher, Clock.systemUTC());
    }

    /**
     * Constructs a new TokenCache instance.
     *
     * @param fetcher TokenFetcher instance.
     * @param clock   Clock instance.
     */
    public TokenCache(TokenFetcher fetcher, Clock clock) {
        this.fetcher = fetcher;
        this.clock = clock;
    }

    /**
     * Gets a valid token, refreshing if needed.
     *
     * @return Token string.
     * @throws RemoteApiException If refresh fails.
     */
    public String getToken() throws RemoteApiException {
        CachedToken current = cached;
        if (isValid(current)) {
            return current.token();
        }

        lock.lock();
        try {
            current = cached;
            if (isValid(current)) {
                return current.token();
            }

            AccessToken fresh = fetcher.fetch();
            current = new CachedToken(fresh.token(), clock.instant().plusSeconds(fresh.expireSeconds() - EARLY_EXPIRY_SECONDS));
            cached = current;
            log.debug("Refreshed tenant access token valid until {}", current.expiresAt());
            return current.token();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the cached token.
     */
    public void invalidate() {
        cached = null;
    }

    private boolean isValid(CachedToken current) {
        return current != null && clock.instant().isBefore(current.expiresAt());
    }

    /**
     * Token paired with its local expiry, swapped as one value.
     */
    private record CachedToken(String token, Instant expiresAt) {
    }

    /**
     * Access token with its advertised lifetime.
     *
     * @param token         Token string.
     * @param expireSeconds Lifetime in seconds.
     */
    public record AccessToken(String token, long expireSeconds) {
    }

    /**
     * Fetches a new access token from the platform.
     */
    @FunctionalInterface
    public interface TokenFetcher {

        /**
         * Fetches a token.
         *
         * @return AccessToken instance.
         * @throws RemoteApiException If the request fails.
         */
        AccessToken fetch() throws RemoteApiException;
    }
}
