package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.ResolutionMethod;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.RouteResult;
import com.dynop.routing.hybrid.model.TravelProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static com.dynop.routing.hybrid.testutil.EngineFixture.MELBOURNE_CBD;
import static com.dynop.routing.hybrid.testutil.EngineFixture.MELBOURNE_SOUTH;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeometryCalculatorTest {

    private final GeometryCalculator calculator = new GeometryCalculator(Map.of(
            TravelProfile.DRIVING, 30.0,
            TravelProfile.WALKING, 5.0,
            TravelProfile.CYCLING, 15.0));

    @Test
    void melbourneCbdPairIsAboutNineHundredMeters() {
        double km = GeometryCalculator.distanceKm(MELBOURNE_CBD, MELBOURNE_SOUTH);
        assertEquals(0.93, km, 0.01);
    }

    @Test
    void distanceIsSymmetricAndZeroForIdenticalPoints() {
        assertEquals(GeometryCalculator.distanceKm(MELBOURNE_CBD, MELBOURNE_SOUTH),
                GeometryCalculator.distanceKm(MELBOURNE_SOUTH, MELBOURNE_CBD), 1e-9);
        assertEquals(0.0, GeometryCalculator.distanceKm(MELBOURNE_CBD, Coordinate.of(-37.8136, 144.9631)));
    }

    @ParameterizedTest
    @CsvSource({
            "51.5074, -0.1278, 48.8566, 2.3522, 343.5",
            "0, 0, 0, 1, 111.2",
            "0, 179.5, 0, -179.5, 111.2"
    })
    void knownDistances(double lat1, double lon1, double lat2, double lon2, double expectedKm) {
        assertEquals(expectedKm, GeometryCalculator.haversineDistanceKm(lat1, lon1, lat2, lon2), 1.0);
    }

    @ParameterizedTest
    @CsvSource({
            "DRIVING, 60.0",
            "WALKING, 360.0",
            "CYCLING, 120.0"
    })
    void durationUsesProfileSpeed(TravelProfile profile, double expectedMinutes) {
        assertEquals(expectedMinutes, calculator.estimateDurationMin(30.0, profile), 1e-9);
    }

    @Test
    void estimateIsTaggedWithRequestedMethod() {
        RouteQuery query = RouteQuery.of(MELBOURNE_CBD, MELBOURNE_SOUTH, TravelProfile.WALKING);

        RouteResult estimate = calculator.estimate(query, ResolutionMethod.ROUTED_FALLBACK);

        assertEquals(ResolutionMethod.ROUTED_FALLBACK, estimate.getMethod());
        assertTrue(estimate.isEstimate());
        assertNull(estimate.getGeometry());
        assertEquals(estimate.getDistanceKm() / 5.0 * 60.0, estimate.getDurationMin(), 1e-9);
    }

    @Test
    void everyProfileNeedsAPositiveSpeed() {
        assertThrows(IllegalArgumentException.class,
                () -> new GeometryCalculator(Map.of(TravelProfile.DRIVING, 30.0)));
        assertThrows(IllegalArgumentException.class, () -> new GeometryCalculator(Map.of(
                TravelProfile.DRIVING, 30.0, TravelProfile.WALKING, 0.0, TravelProfile.CYCLING, 15.0)));
    }
}
