package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.ResolutionMethod;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;
import com.dynop.routing.hybrid.model.TravelProfile;
import com.graphhopper.util.DistanceCalc;
import com.graphhopper.util.DistanceCalcEarth;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Great-circle distance and duration estimates.
 *
 * <p>Distances use the Haversine formula on a sphere with the mean Earth radius (6371 km). Durations
 * assume a constant average speed per {@link TravelProfile}. Callers are responsible for validating
 * coordinate ranges; {@link Coordinate} already does so on construction.
 */
public final class GeometryCalculator {

    private static final DistanceCalc EARTH = DistanceCalcEarth.DIST_EARTH;

    private final Map<TravelProfile, Double> speedsKmh;

    /**
     * @param speedsKmh assumed average speed per profile; every profile must be present
     */
    public GeometryCalculator(Map<TravelProfile, Double> speedsKmh) {
        Objects.requireNonNull(speedsKmh, "speedsKmh");
        EnumMap<TravelProfile, Double> copy = new EnumMap<>(TravelProfile.class);
        for (TravelProfile profile : TravelProfile.values()) {
            Double speed = speedsKmh.get(profile);
            if (speed == null || !(speed > 0)) {
                throw new IllegalArgumentException("Missing or non-positive speed for profile " + profile.getId());
            }
            copy.put(profile, speed);
        }
        this.speedsKmh = copy;
    }

    /**
     * Great-circle distance between two coordinates.
     *
     * @return distance in kilometers; zero for identical coordinates, symmetric in its arguments
     */
    public static double distanceKm(Coordinate a, Coordinate b) {
        if (a.equals(b)) {
            return 0.0;
        }
        return haversineDistanceKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    /**
     * Haversine distance on raw degrees.
     *
     * @return distance in kilometers
     */
    public static double haversineDistanceKm(double lat1, double lon1, double lat2, double lon2) {
        return EARTH.calcDist(lat1, lon1, lat2, lon2) / 1000.0;
    }

    /**
     * @return estimated travel time in minutes at the profile's assumed speed
     */
    public double estimateDurationMin(double distanceKm, TravelProfile profile) {
        return distanceKm / speedsKmh.get(profile) * 60.0;
    }

    /**
     * Builds a great-circle estimate for a query.
     *
     * @param method {@link ResolutionMethod#GEOMETRY} or {@link ResolutionMethod#ROUTED_FALLBACK}
     */
    public RouteResult estimate(RouteQuery query, ResolutionMethod method) {
        double km = distanceKm(query.getFrom(), query.getTo());
        return RouteResult.estimate(km, estimateDurationMin(km, query.getProfile()), method);
    }
}
