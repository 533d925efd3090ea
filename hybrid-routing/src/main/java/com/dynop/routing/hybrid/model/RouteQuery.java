package com.dynop.routing.hybrid.model;

import java.util.Objects;

/**
 * Immutable origin/destination pair for a given travel profile.
 */
public final class RouteQuery {

    private final Coordinate from;
    private final Coordinate to;
    private final TravelProfile profile;

    public RouteQuery(Coordinate from, Coordinate to, TravelProfile profile) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.profile = Objects.requireNonNull(profile, "profile");
    }

    public static RouteQuery of(Coordinate from, Coordinate to, TravelProfile profile) {
        return new RouteQuery(from, to, profile);
    }

    public Coordinate getFrom() {
        return from;
    }

    public Coordinate getTo() {
        return to;
    }

    public TravelProfile getProfile() {
        return profile;
    }

    /**
     * @return true if origin and destination are the same position
     */
    public boolean isDegenerate() {
        return from.equals(to);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteQuery)) {
            return false;
        }
        RouteQuery other = (RouteQuery) o;
        return from.equals(other.from) && to.equals(other.to) && profile == other.profile;
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, profile);
    }

    @Override
    public String toString() {
        return "RouteQuery{" + profile.getId() + " " + from + " -> " + to + "}";
    }
}
