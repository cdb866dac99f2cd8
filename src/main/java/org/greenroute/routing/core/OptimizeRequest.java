package org.greenroute.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.greenroute.routing.geo.Location;
import org.greenroute.routing.model.Constraints;
import org.greenroute.routing.model.Preferences;
import org.greenroute.routing.model.Stop;

import java.time.Duration;
import java.util.List;

/**
 * Client-facing single-vehicle optimization request.
 */
@Value
@Builder
public class OptimizeRequest {
    /** Depot coordinate. */
    Location origin;
    /** Delivery stops in caller order; node {@code i + 1} in the matrices. */
    @Singular
    List<Stop> destinations;
    /** Vehicle type key; {@code null} resolves to the lookup default. */
    String vehicleType;
    /** Optional constraints; {@code null} means unconstrained. */
    Constraints constraints;
    /** Optional preferences; {@code null} means defaults. */
    Preferences preferences;
    /** Optional solver budget override; {@code null} uses the optimizer default. */
    Duration timeLimit;
}
