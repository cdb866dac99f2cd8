package org.greenroute.routing.matrix;

import org.greenroute.routing.conditions.RoadConditions;
import org.greenroute.routing.geo.GeoMetric;
import org.greenroute.routing.geo.Location;
import org.greenroute.routing.model.Preferences;
import org.greenroute.routing.model.Stop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds great-circle distance and condition-adjusted time matrices.
 *
 * <p>Base travel time assumes {@value #ASSUMED_SPEED_KMH} km/h. Traffic and weather are
 * global scalars, so the time matrix stays symmetric like the distance matrix. The builder
 * never fails for validated input.</p>
 */
public final class MatrixBuilder {
    private static final Logger log = LoggerFactory.getLogger(MatrixBuilder.class);

    public static final double ASSUMED_SPEED_KMH = 50.0d;

    /**
     * Builds the matrix pair for depot plus stops.
     *
     * @param depot route origin, node 0.
     * @param stops destinations, nodes {@code 1..stops.size()}.
     * @param conditions already-defaulted multipliers.
     * @param preferences routing hints; recorded only.
     * @return immutable matrix pair.
     */
    public CostMatrix build(Location depot, List<Stop> stops, RoadConditions conditions, Preferences preferences) {
        if (preferences != null && log.isDebugEnabled()) {
            log.debug("Routing hints avoidTolls={} avoidHighways={} preferMainRoads={} have no effect on great-circle matrices",
                    preferences.isAvoidTolls(), preferences.isAvoidHighways(), preferences.isPreferMainRoads());
        }

        int n = stops.size() + 1;
        Location[] points = new Location[n];
        points[0] = depot;
        for (int i = 0; i < stops.size(); i++) {
            points[i + 1] = stops.get(i).getLocation();
        }

        double traffic = conditions.getTrafficMultiplier();
        double weather = conditions.getWeatherMultiplier();
        double[][] distance = new double[n][n];
        double[][] time = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double km = GeoMetric.distance(points[i], points[j]);
                double minutes = km / ASSUMED_SPEED_KMH * 60.0d * traffic * weather;
                distance[i][j] = km;
                distance[j][i] = km;
                time[i][j] = minutes;
                time[j][i] = minutes;
            }
        }
        return CostMatrix.of(distance, time);
    }
}
