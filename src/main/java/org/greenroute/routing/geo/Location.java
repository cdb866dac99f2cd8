package org.greenroute.routing.geo;

import lombok.Value;

/**
 * Immutable WGS84 coordinate in degrees.
 *
 * <p>Range checks are not applied on construction; request validation calls
 * {@link GeoMetric#isValid(Location)} before any matrix is built.</p>
 */
@Value(staticConstructor = "of")
public class Location {
    /** Latitude in degrees, expected in {@code [-90, 90]}. */
    double latitude;
    /** Longitude in degrees, expected in {@code [-180, 180]}. */
    double longitude;
}
