package org.greenroute.routing.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link KeyValueStore}.
 *
 * <p>Expired entries are dropped lazily on read, or eagerly by {@link #purgeExpired()}.</p>
 */
public final class InMemoryTtlStore<K, V> implements KeyValueStore<K, V> {
    private final Clock clock;
    private final ConcurrentMap<K, Entry<V>> entries = new ConcurrentHashMap<>();

    public InMemoryTtlStore() {
        this(Clock.systemUTC());
    }

    public InMemoryTtlStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive, got " + ttl);
        }
        entries.put(key, new Entry<>(value, clock.instant().plus(ttl)));
    }

    @Override
    public Optional<V> get(K key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public boolean remove(K key) {
        Entry<V> removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        Iterator<Map.Entry<K, Entry<V>>> iterator = entries.entrySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().getValue().isExpired(now)) {
                iterator.remove();
                purged++;
            }
        }
        return purged;
    }

    @Override
    public int size() {
        return entries.size();
    }

    private record Entry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
