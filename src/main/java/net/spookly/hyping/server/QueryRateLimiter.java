package net.spookly.hyping.server;

import java.net.InetAddress;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import net.spookly.hyping.config.HypingConfig;

/**
 * Per-source-address token bucket.
 * <p>
 * Buckets untouched for a full cleanup interval are purged so spoofed sources cannot grow the
 * table without bound.
 */
public final class QueryRateLimiter {
    private static final long CLEANUP_INTERVAL_MILLIS = 60_000L;

    private final Map<InetAddress, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final int burst;
    private final double refillPerMilli;
    private final Clock clock;
    private final AtomicLong lastCleanup;

    public QueryRateLimiter(int burst, int refillPerSecond, Clock clock) {
        if (burst <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("burst and refillPerSecond must be greater than 0");
        }
        this.burst = burst;
        this.refillPerMilli = refillPerSecond / 1_000.0;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.lastCleanup = new AtomicLong(this.clock.millis());
    }

    /**
     * Build a limiter from config, or null when rate limiting is disabled.
     */
    public static QueryRateLimiter fromConfig(HypingConfig.RateLimitConfig config) {
        if (config == null || !Boolean.TRUE.equals(config.enabled)) {
            return null;
        }
        return new QueryRateLimiter(config.burst, config.refillPerSecond, null);
    }

    public boolean tryAcquire(InetAddress address) {
        if (address == null) {
            return true;
        }
        long now = clock.millis();
        cleanupIfNeeded(now);
        TokenBucket bucket = buckets.computeIfAbsent(address, ignored -> new TokenBucket(burst, now));
        return bucket.tryConsume(now, burst, refillPerMilli);
    }

    int trackedAddresses() {
        return buckets.size();
    }

    private void cleanupIfNeeded(long now) {
        long last = lastCleanup.get();
        if (now - last < CLEANUP_INTERVAL_MILLIS || !lastCleanup.compareAndSet(last, now)) {
            return;
        }
        long staleBefore = now - CLEANUP_INTERVAL_MILLIS;
        buckets.entrySet().removeIf(entry -> entry.getValue().lastAccessMillis() < staleBefore);
    }

    private static final class TokenBucket {
        private double tokens;
        private long lastRefillMillis;
        private volatile long lastAccessMillis;

        private TokenBucket(int burst, long now) {
            this.tokens = burst;
            this.lastRefillMillis = now;
            this.lastAccessMillis = now;
        }

        private synchronized boolean tryConsume(long now, int burst, double refillPerMilli) {
            long elapsed = Math.max(0L, now - lastRefillMillis);
            tokens = Math.min(burst, tokens + elapsed * refillPerMilli);
            lastRefillMillis = now;
            lastAccessMillis = now;
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        }

        private long lastAccessMillis() {
            return lastAccessMillis;
        }
    }
}
