package org.greenroute.routing.model;

import lombok.Builder;
import lombok.Value;
import org.greenroute.routing.geo.Location;

/**
 * Delivery stop submitted for one optimize call.
 */
@Value
@Builder(toBuilder = true)
public class Stop {
    public static final int DEFAULT_PRIORITY = 1;

    /** Caller-supplied identifier, or a generated {@code stop-<n>} id. */
    String stopId;
    /** Stop coordinate. */
    Location location;
    /** Delivery priority; carried through to the route, not used as a cost term. */
    @Builder.Default
    int priority = DEFAULT_PRIORITY;
    /** Optional dwell time at the stop, counted against the duration limit. */
    Integer serviceTimeMinutes;
    /** Optional free-text address, pass-through. */
    String address;
}
