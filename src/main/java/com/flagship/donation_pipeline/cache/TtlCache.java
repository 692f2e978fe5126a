package com.flagship.donation_pipeline.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache whose entries expire after a per-entry time to live.
 *
 * The default implementation is process-local. A shared implementation can be
 * swapped in without touching callers.
 */
public interface TtlCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value, Duration ttl);

    void invalidate(K key);
}
