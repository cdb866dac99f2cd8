package org.greenroute.routing.conditions;

import org.greenroute.routing.geo.Location;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic traffic estimate from the local hour of day.
 *
 * <p>Rush hours (07-09 and 17-19 inclusive) apply {@value #RUSH_HOUR_MULTIPLIER},
 * daytime (10-16) applies {@value #DAYTIME_MULTIPLIER}, all other hours are free flow.</p>
 */
public final class TimeOfDayTrafficProvider implements TrafficProvider {
    public static final double RUSH_HOUR_MULTIPLIER = 1.4d;
    public static final double DAYTIME_MULTIPLIER = 1.1d;
    public static final double FREE_FLOW_MULTIPLIER = 1.0d;

    private final Clock clock;

    public TimeOfDayTrafficProvider(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public double getMultiplier(Location origin, List<Location> destinations) {
        return multiplierForHour(ZonedDateTime.now(clock).getHour());
    }

    static double multiplierForHour(int hour) {
        if ((hour >= 7 && hour <= 9) || (hour >= 17 && hour <= 19)) {
            return RUSH_HOUR_MULTIPLIER;
        }
        if (hour >= 10 && hour <= 16) {
            return DAYTIME_MULTIPLIER;
        }
        return FREE_FLOW_MULTIPLIER;
    }
}
