package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;
import org.greenroute.routing.store.KeyValueStore;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Caches traffic multipliers per coordinate set.
 *
 * <p>Failures of the delegate are not cached and propagate to the caller.</p>
 */
public final class CachingTrafficProvider implements TrafficProvider {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private final TrafficProvider delegate;
    private final KeyValueStore<String, Double> cache;
    private final Duration ttl;

    public CachingTrafficProvider(TrafficProvider delegate, KeyValueStore<String, Double> cache) {
        this(delegate, cache, DEFAULT_TTL);
    }

    public CachingTrafficProvider(TrafficProvider delegate, KeyValueStore<String, Double> cache, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    @Override
    public double getMultiplier(Location origin, List<Location> destinations) {
        String key = cacheKey(origin, destinations);
        Optional<Double> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        double multiplier = delegate.getMultiplier(origin, destinations);
        cache.put(key, multiplier, ttl);
        return multiplier;
    }

    static String cacheKey(Location origin, List<Location> destinations) {
        StringBuilder key = new StringBuilder("traffic:");
        append(key, origin);
        for (Location destination : destinations) {
            key.append(';');
            append(key, destination);
        }
        return key.toString();
    }

    private static void append(StringBuilder key, Location location) {
        key.append(location.getLatitude()).append(',').append(location.getLongitude());
    }
}
