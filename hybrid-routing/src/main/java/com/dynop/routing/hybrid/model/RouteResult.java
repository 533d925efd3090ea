package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable outcome of a distance/route resolution.
 *
 * <p>Invariants enforced at construction:
 * <ul>
 *   <li>{@code distanceKm} and {@code durationMin} are finite and non-negative</li>
 *   <li>{@link ResolutionMethod#ROUTED} results are never estimates</li>
 *   <li>{@link ResolutionMethod#GEOMETRY} and {@link ResolutionMethod#ROUTED_FALLBACK} results are always estimates</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RouteResult {

    private final double distanceKm;
    private final double durationMin;
    private final List<Coordinate> geometry;
    private final List<String> instructions;
    private final ResolutionMethod method;
    private final boolean estimate;

    @JsonCreator
    public RouteResult(
            @JsonProperty("distanceKm") double distanceKm,
            @JsonProperty("durationMin") double durationMin,
            @JsonProperty("geometry") List<Coordinate> geometry,
            @JsonProperty("instructions") List<String> instructions,
            @JsonProperty(value = "method", required = true) ResolutionMethod method,
            @JsonProperty("isEstimate") boolean estimate) {
        this.distanceKm = requireNonNegative(distanceKm, "distanceKm");
        this.durationMin = requireNonNegative(durationMin, "durationMin");
        this.geometry = geometry == null ? null : Collections.unmodifiableList(List.copyOf(geometry));
        this.instructions = instructions == null ? null : Collections.unmodifiableList(List.copyOf(instructions));
        this.method = Objects.requireNonNull(method, "method");
        if (method == ResolutionMethod.ROUTED && estimate) {
            throw new IllegalArgumentException("routed results cannot be estimates");
        }
        if (method != ResolutionMethod.ROUTED && !estimate) {
            throw new IllegalArgumentException(method + " results must be estimates");
        }
        this.estimate = estimate;
    }

    /**
     * Creates an authoritative routed result.
     */
    public static RouteResult routed(double distanceKm, double durationMin,
                                     List<Coordinate> geometry, List<String> instructions) {
        return new RouteResult(distanceKm, durationMin, geometry, instructions, ResolutionMethod.ROUTED, false);
    }

    /**
     * Creates a great-circle estimate.
     *
     * @param method {@link ResolutionMethod#GEOMETRY} or {@link ResolutionMethod#ROUTED_FALLBACK}
     */
    public static RouteResult estimate(double distanceKm, double durationMin, ResolutionMethod method) {
        return new RouteResult(distanceKm, durationMin, null, null, method, true);
    }

    public double getDistanceKm() {
        return distanceKm;
    }

    public double getDurationMin() {
        return durationMin;
    }

    /**
     * @return route polyline, or null if not available or stripped
     */
    public List<Coordinate> getGeometry() {
        return geometry;
    }

    /**
     * @return turn-by-turn instructions, or null if not available
     */
    public List<String> getInstructions() {
        return instructions;
    }

    public ResolutionMethod getMethod() {
        return method;
    }

    @JsonProperty("isEstimate")
    public boolean isEstimate() {
        return estimate;
    }

    /**
     * @return this result without its geometry, or this instance if it has none
     */
    public RouteResult withoutGeometry() {
        if (geometry == null) {
            return this;
        }
        return new RouteResult(distanceKm, durationMin, null, instructions, method, estimate);
    }

    private static double requireNonNegative(double value, String label) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException(label + " must be a finite non-negative value");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteResult)) {
            return false;
        }
        RouteResult other = (RouteResult) o;
        return Double.compare(distanceKm, other.distanceKm) == 0
                && Double.compare(durationMin, other.durationMin) == 0
                && estimate == other.estimate
                && method == other.method
                && Objects.equals(geometry, other.geometry)
                && Objects.equals(instructions, other.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(distanceKm, durationMin, geometry, instructions, method, estimate);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RouteResult{distanceKm=%.3f, durationMin=%.2f, method=%s, estimate=%s}",
                distanceKm, durationMin, method, estimate);
    }
}
