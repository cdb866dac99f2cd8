package org.greenroute.routing.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store with per-entry time-to-live.
 *
 * @param <K> key type.
 * @param <V> value type.
 */
public interface KeyValueStore<K, V> {
    /**
     * Stores a value that expires after {@code ttl}.
     *
     * @throws IllegalArgumentException when ttl is zero or negative.
     */
    void put(K key, V value, Duration ttl);

    /**
     * Returns the live value for a key, or empty when absent or expired.
     */
    Optional<V> get(K key);

    /**
     * Removes a key, returning whether a live entry was present.
     */
    boolean remove(K key);

    /**
     * Drops every expired entry and returns the number dropped.
     */
    int purgeExpired();

    /**
     * Returns the number of stored entries, expired ones included until purged.
     */
    int size();
}
