package org.greenroute.routing.metrics;

/**
 * Resolves vehicle specifications by type name.
 */
@FunctionalInterface
public interface VehicleSpecLookup {
    /**
     * Returns the spec for a vehicle type. Implementations pick a default spec for
     * unknown types rather than failing.
     */
    VehicleSpec lookup(String vehicleType);
}
