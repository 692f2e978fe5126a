package com.flagship.donation_pipeline.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link TtlCache} backed by Caffeine with a per-entry expiry.
 *
 * Caffeine reads time from a ticker adapted from the injected {@link Clock}, so
 * expiry follows whatever clock the application (or a test) supplies.
 */
public class CaffeineTtlCache<K, V> implements TtlCache<K, V> {

    private final Cache<K, Timed<V>> cache;

    public CaffeineTtlCache(Clock clock, long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(() -> toNanos(clock.instant()))
                .executor(Runnable::run)
                .expireAfter(new Expiry<K, Timed<V>>() {
                    @Override
                    public long expireAfterCreate(K key, Timed<V> value, long currentTime) {
                        return value.ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(K key, Timed<V> value, long currentTime, long currentDuration) {
                        return value.ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(K key, Timed<V> value, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        Timed<V> timed = cache.getIfPresent(key);
        return timed == null ? Optional.empty() : Optional.of(timed.value);
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) {
            cache.invalidate(key);
            return;
        }
        cache.put(key, new Timed<>(value, ttl.toNanos()));
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    private static long toNanos(Instant instant) {
        return instant.getEpochSecond() * 1_000_000_000L + instant.getNano();
    }

    private static final class Timed<V> {
        private final V value;
        private final long ttlNanos;

        private Timed(V value, long ttlNanos) {
            this.value = value;
            this.ttlNanos = ttlNanos;
        }
    }
}
