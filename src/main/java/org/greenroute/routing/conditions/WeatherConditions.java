package org.greenroute.routing.conditions;

import lombok.Builder;
import lombok.Value;

/**
 * Observed weather at one location.
 */
@Value
@Builder
public class WeatherConditions {
    /** Condition label such as {@code clear} or {@code rain}. */
    @Builder.Default
    String condition = "clear";
    double temperatureCelsius;
    double precipitationMm;
    double windSpeedKmh;
    @Builder.Default
    double visibilityKm = 10.0d;
}
