package com.dynop.routing.hybrid.client;

import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON codec for the OpenRouteService directions API.
 *
 * <h2>Request</h2>
 * <pre>{@code
 * {"coordinates": [[lon, lat], [lon, lat]], "format": "json", "instructions": true, "geometry": true}
 * }</pre>
 *
 * <h2>Response</h2>
 * <ul>
 *   <li>{@code routes[0].summary.distance} in meters, converted to kilometers</li>
 *   <li>{@code routes[0].summary.duration} in seconds, converted to minutes</li>
 *   <li>{@code routes[0].geometry.coordinates} as {@code [lon, lat]} pairs</li>
 *   <li>{@code routes[0].segments[0].steps[].instruction}</li>
 * </ul>
 * The provider omits zero-valued summary fields, so a missing distance or duration reads as zero.
 */
public final class RouteResponseCodec {

    private final ObjectMapper objectMapper;

    public RouteResponseCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public String encodeRequest(RouteQuery query) {
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode coordinates = body.putArray("coordinates");
        coordinates.addArray()
                .add(query.getFrom().getLongitude())
                .add(query.getFrom().getLatitude());
        coordinates.addArray()
                .add(query.getTo().getLongitude())
                .add(query.getTo().getLatitude());
        body.put("format", "json");
        body.put("instructions", true);
        body.put("geometry", true);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode routing request for " + query, e);
        }
    }

    /**
     * @throws RouteProviderException if the body is not valid JSON, has no routes or a malformed route
     */
    public RouteResult decodeResponse(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RouteProviderException(RouteProviderException.MALFORMED_PAYLOAD,
                    "Response is not valid JSON", -1, e);
        }
        if (root == null || !root.isObject()) {
            throw new RouteProviderException(RouteProviderException.MALFORMED_PAYLOAD, "Response is not a JSON object");
        }

        JsonNode routes = root.get("routes");
        if (routes == null || !routes.isArray() || routes.isEmpty()) {
            throw new RouteProviderException(RouteProviderException.NO_ROUTES, "No routes found in response");
        }

        JsonNode route = routes.get(0);
        JsonNode summary = route.get("summary");
        if (summary == null || !summary.isObject()) {
            throw new RouteProviderException(RouteProviderException.MALFORMED_PAYLOAD, "Route has no summary");
        }

        try {
            double distanceMeters = readNonNegative(summary, "distance");
            double durationSeconds = readNonNegative(summary, "duration");
            return RouteResult.routed(
                    distanceMeters / 1000.0,
                    durationSeconds / 60.0,
                    readGeometry(route.get("geometry")),
                    readInstructions(route.get("segments")));
        } catch (IllegalArgumentException e) {
            throw new RouteProviderException(RouteProviderException.MALFORMED_PAYLOAD, e.getMessage(), -1, e);
        }
    }

    private static double readNonNegative(JsonNode summary, String field) {
        JsonNode value = summary.get(field);
        if (value == null || value.isNull()) {
            return 0.0;
        }
        if (!value.isNumber() || value.asDouble() < 0) {
            throw new IllegalArgumentException("summary." + field + " must be a non-negative number");
        }
        return value.asDouble();
    }

    private static List<Coordinate> readGeometry(JsonNode geometry) {
        List<Coordinate> points = new ArrayList<>();
        if (geometry == null || !geometry.isObject()) {
            return points;
        }
        JsonNode coordinates = geometry.get("coordinates");
        if (coordinates == null || !coordinates.isArray()) {
            return points;
        }
        for (JsonNode pair : coordinates) {
            if (!pair.isArray() || pair.size() < 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
                throw new IllegalArgumentException("geometry coordinates must be [lon, lat] pairs");
            }
            points.add(new Coordinate(pair.get(1).asDouble(), pair.get(0).asDouble()));
        }
        return points;
    }

    private static List<String> readInstructions(JsonNode segments) {
        List<String> instructions = new ArrayList<>();
        if (segments == null || !segments.isArray() || segments.isEmpty()) {
            return instructions;
        }
        JsonNode steps = segments.get(0).get("steps");
        if (steps == null || !steps.isArray()) {
            return instructions;
        }
        for (JsonNode step : steps) {
            JsonNode instruction = step.get("instruction");
            if (instruction != null && instruction.isTextual()) {
                instructions.add(instruction.asText());
            }
        }
        return instructions;
    }
}
