package org.greenroute.routing.conditions;

import lombok.Value;

/**
 * Already-defaulted global travel-time multipliers for one optimize call.
 */
@Value
public class RoadConditions {
    /** Global traffic multiplier, {@code > 0}. */
    double trafficMultiplier;
    /** Global weather impact multiplier in {@code (0, 2]}. */
    double weatherMultiplier;
    /** Whether the traffic value is a substituted default after a collaborator failure. */
    boolean trafficDegraded;
    /** Whether the weather value is a substituted default after a collaborator failure. */
    boolean weatherDegraded;
}
