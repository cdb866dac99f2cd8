package org.greenroute.routing.metrics;

import java.util.Map;

/**
 * Built-in read-only vehicle table. Unknown types resolve to {@value #DEFAULT_VEHICLE_TYPE}.
 *
 * <p>The table is immutable and safe for unsynchronized concurrent reads.</p>
 */
public final class StaticVehicleSpecTable implements VehicleSpecLookup {
    public static final String DEFAULT_VEHICLE_TYPE = "diesel_truck";

    private static final Map<String, VehicleSpec> SPECS = Map.of(
            "diesel_truck", spec("diesel_truck", "diesel", 35.0d),
            "petrol_truck", spec("petrol_truck", "petrol", 40.0d),
            "electric_truck", spec("electric_truck", "electric", 0.0d),
            "hybrid_truck", spec("hybrid_truck", "hybrid", 25.0d),
            "hydrogen_truck", spec("hydrogen_truck", "hydrogen", 0.0d)
    );

    @Override
    public VehicleSpec lookup(String vehicleType) {
        if (vehicleType == null) {
            return SPECS.get(DEFAULT_VEHICLE_TYPE);
        }
        return SPECS.getOrDefault(vehicleType, SPECS.get(DEFAULT_VEHICLE_TYPE));
    }

    private static VehicleSpec spec(String type, String fuel, double litersPer100km) {
        return VehicleSpec.builder()
                .vehicleType(type)
                .fuelType(fuel)
                .fuelEfficiencyLPer100km(litersPer100km)
                .build();
    }
}
