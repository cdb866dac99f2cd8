package org.greenroute.routing.model;

import lombok.Builder;
import lombok.Value;

/**
 * Caller optimization preferences.
 *
 * <p>The avoid/prefer flags are routing hints only; with great-circle matrices there is
 * no road network to apply them to.</p>
 */
@Value
@Builder
public class Preferences {
    private static final Preferences DEFAULTS = Preferences.builder().build();

    @Builder.Default
    OptimizeFor optimizeFor = OptimizeFor.TIME;
    boolean avoidTolls;
    boolean avoidHighways;
    @Builder.Default
    boolean preferMainRoads = true;
    /** When false the traffic provider is skipped and a neutral multiplier is used. */
    @Builder.Default
    boolean considerTraffic = true;
    /** When false the weather provider is skipped and a neutral multiplier is used. */
    @Builder.Default
    boolean considerWeather = true;

    public static Preferences defaults() {
        return DEFAULTS;
    }
}
