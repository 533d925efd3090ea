package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteResultTest {

    @Test
    void routedResultsAreNeverEstimates() {
        assertThrows(IllegalArgumentException.class,
                () -> new RouteResult(1, 1, null, null, ResolutionMethod.ROUTED, true));
        assertFalse(RouteResult.routed(1, 1, List.of(), List.of()).isEstimate());
    }

    @Test
    void geometricResultsAreAlwaysEstimates() {
        assertThrows(IllegalArgumentException.class,
                () -> new RouteResult(1, 1, null, null, ResolutionMethod.GEOMETRY, false));
        assertThrows(IllegalArgumentException.class,
                () -> new RouteResult(1, 1, null, null, ResolutionMethod.ROUTED_FALLBACK, false));
        assertTrue(RouteResult.estimate(1, 1, ResolutionMethod.ROUTED_FALLBACK).isEstimate());
    }

    @Test
    void rejectsNegativeOrNonFiniteValues() {
        assertThrows(IllegalArgumentException.class, () -> RouteResult.estimate(-0.1, 1, ResolutionMethod.GEOMETRY));
        assertThrows(IllegalArgumentException.class,
                () -> RouteResult.estimate(1, Double.NaN, ResolutionMethod.GEOMETRY));
        assertThrows(IllegalArgumentException.class,
                () -> RouteResult.routed(Double.POSITIVE_INFINITY, 1, null, null));
    }

    @Test
    void withoutGeometryKeepsEverythingElse() {
        RouteResult full = RouteResult.routed(2.5, 6.0,
                List.of(Coordinate.of(1, 1), Coordinate.of(2, 2)), List.of("Head north"));

        RouteResult stripped = full.withoutGeometry();

        assertNull(stripped.getGeometry());
        assertEquals(List.of("Head north"), stripped.getInstructions());
        assertEquals(2.5, stripped.getDistanceKm());
        assertEquals(ResolutionMethod.ROUTED, stripped.getMethod());
        assertSame(stripped, stripped.withoutGeometry());
    }

    @Test
    void serializesWithWireNames() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        JsonNode json = mapper.valueToTree(RouteResult.estimate(0.93, 1.86, ResolutionMethod.ROUTED_FALLBACK));

        assertEquals("routed-fallback", json.get("method").asText());
        assertTrue(json.get("isEstimate").asBoolean());
        assertFalse(json.has("geometry"));
        assertEquals(RouteResult.estimate(0.93, 1.86, ResolutionMethod.ROUTED_FALLBACK),
                mapper.treeToValue(json, RouteResult.class));
    }
}
