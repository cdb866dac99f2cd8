package org.greenroute.routing.store;

import org.greenroute.routing.core.OptimizationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RouteStore} on top of a {@link KeyValueStore}, entries live for 24 hours by default.
 */
public final class KeyValueRouteStore implements RouteStore {
    private static final Logger log = LoggerFactory.getLogger(KeyValueRouteStore.class);

    public static final Duration DEFAULT_TTL = Duration.ofHours(24);

    private final KeyValueStore<String, OptimizationResult> store;
    private final Duration ttl;

    public KeyValueRouteStore(KeyValueStore<String, OptimizationResult> store) {
        this(store, DEFAULT_TTL);
    }

    public KeyValueRouteStore(KeyValueStore<String, OptimizationResult> store, Duration ttl) {
        this.store = Objects.requireNonNull(store, "store");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    @Override
    public void save(String routeId, OptimizationResult result) {
        if (routeId == null || routeId.isBlank()) {
            throw new IllegalArgumentException("routeId must be non-blank");
        }
        store.put(routeId, Objects.requireNonNull(result, "result"), ttl);
        log.debug("Route {} stored for {}", routeId, ttl);
    }

    @Override
    public Optional<OptimizationResult> find(String routeId) {
        if (routeId == null) {
            return Optional.empty();
        }
        return store.get(routeId);
    }
}
