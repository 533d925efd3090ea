package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Immutable WGS84 position.
 *
 * <p>Latitude must lie in {@code [-90, 90]} and longitude in {@code [-180, 180]}; both must be finite.
 */
public final class Coordinate {

    private final double latitude;
    private final double longitude;

    @JsonCreator
    public Coordinate(
            @JsonProperty(value = "latitude", required = true) double latitude,
            @JsonProperty(value = "longitude", required = true) double longitude) {
        this.latitude = requireInRange(latitude, -90.0, 90.0, "latitude");
        this.longitude = requireInRange(longitude, -180.0, 180.0, "longitude");
    }

    public static Coordinate of(double latitude, double longitude) {
        return new Coordinate(latitude, longitude);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    private static double requireInRange(double value, double min, double max, String label) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(label + " must be a finite double");
        }
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                    String.format(Locale.ROOT, "%s %.6f outside [%.1f, %.1f]", label, value, min, max));
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate)) {
            return false;
        }
        Coordinate other = (Coordinate) o;
        return Double.compare(latitude, other.latitude) == 0
                && Double.compare(longitude, other.longitude) == 0;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.6f, %.6f)", latitude, longitude);
    }
}
