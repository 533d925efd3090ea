package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identified destination in a batch request.
 */
public final class Destination {

    private final String id;
    private final Coordinate coordinate;

    @JsonCreator
    public Destination(
            @JsonProperty(value = "id", required = true) String id,
            @JsonProperty(value = "coordinate", required = true) Coordinate coordinate) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.coordinate = Objects.requireNonNull(coordinate, "coordinate is required");
    }

    public static Destination of(String id, Coordinate coordinate) {
        return new Destination(id, coordinate);
    }

    public String getId() {
        return id;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    @Override
    public String toString() {
        return "Destination{" + id + " " + coordinate + "}";
    }
}
