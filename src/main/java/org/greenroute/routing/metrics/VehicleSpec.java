package org.greenroute.routing.metrics;

import lombok.Builder;
import lombok.Value;

/**
 * Vehicle characteristics used for fuel and cost figures.
 */
@Value
@Builder
public class VehicleSpec {
    public static final double DEFAULT_FUEL_PRICE_PER_LITER = 1.5d;
    public static final double DEFAULT_DRIVER_HOURLY_RATE = 25.0d;

    String vehicleType;
    String fuelType;
    /** Liters per 100 km; 0 for vehicles that burn no liquid fuel. */
    double fuelEfficiencyLPer100km;
    /** USD per liter. */
    @Builder.Default
    double fuelPricePerLiter = DEFAULT_FUEL_PRICE_PER_LITER;
    /** USD per driving hour. */
    @Builder.Default
    double driverHourlyRate = DEFAULT_DRIVER_HOURLY_RATE;
}
