package org.greenroute.routing.store;

import org.greenroute.routing.core.OptimizationResult;
import org.greenroute.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("KeyValueRouteStore Tests")
class KeyValueRouteStoreTest {

    @Test
    @DisplayName("Saved results are found by route id for 24 hours")
    void testSaveAndFind() {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        KeyValueRouteStore routes = new KeyValueRouteStore(new InMemoryTtlStore<>(clock));
        OptimizationResult result = OptimizationResult.builder().routeId("r-1").vehicleType("diesel_truck").build();

        routes.save("r-1", result);
        clock.advance(Duration.ofHours(23));
        assertEquals(Optional.of(result), routes.find("r-1"));

        clock.advance(Duration.ofHours(1));
        assertEquals(Optional.empty(), routes.find("r-1"));
    }

    @Test
    @DisplayName("Unknown and null ids find nothing, blank ids cannot be saved")
    void testInvalidIds() {
        KeyValueRouteStore routes = new KeyValueRouteStore(new InMemoryTtlStore<>());
        OptimizationResult result = OptimizationResult.builder().routeId("r-2").build();

        assertEquals(Optional.empty(), routes.find("missing"));
        assertEquals(Optional.empty(), routes.find(null));
        assertThrows(IllegalArgumentException.class, () -> routes.save(" ", result));
        assertThrows(IllegalArgumentException.class, () -> routes.save(null, result));
        assertThrows(NullPointerException.class, () -> routes.save("r-2", null));
    }
}
