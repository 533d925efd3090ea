package com.dynop.routing.hybrid.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TravelProfileTest {

    @ParameterizedTest
    @CsvSource({
            "driving, DRIVING, driving-car",
            "walking, WALKING, foot-walking",
            "cycling, CYCLING, cycling-regular",
            "Driving, DRIVING, driving-car",
            "foot-walking, WALKING, foot-walking"
    })
    void parsesNamesAndMapsToProviderProfiles(String value, TravelProfile expected, String providerProfile) {
        TravelProfile profile = TravelProfile.parse(value);
        assertEquals(expected, profile);
        assertEquals(providerProfile, profile.getProviderProfile());
    }

    @Test
    void missingProfileDefaultsToDriving() {
        assertEquals(TravelProfile.DRIVING, TravelProfile.parse(null));
        assertEquals(TravelProfile.DRIVING, TravelProfile.parse("  "));
    }

    @Test
    void unknownProfileIsRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> TravelProfile.parse("flying"));
        assertEquals("Invalid profile: flying. Valid values: driving, walking, cycling", ex.getMessage());
    }
}
