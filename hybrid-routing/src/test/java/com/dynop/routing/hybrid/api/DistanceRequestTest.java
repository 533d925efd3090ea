package com.dynop.routing.hybrid.api;

import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.engine.BatchOptions;
import com.dynop.routing.hybrid.engine.ResolveOptions;
import com.dynop.routing.hybrid.model.TravelProfile;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.jackson.Jackson;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DistanceRequestTest {

    private final ObjectMapper mapper = Jackson.newObjectMapper();

    @Test
    void optionalFieldsTakeDefaults() throws Exception {
        DistanceRequest request = mapper.readValue(
                "{\"from\":{\"latitude\":-37.8136,\"longitude\":144.9631},"
                        + "\"to\":{\"latitude\":-37.82,\"longitude\":144.97}}",
                DistanceRequest.class);

        assertEquals(TravelProfile.DRIVING, request.getProfile());
        assertFalse(request.isForceRouting());
        assertTrue(request.isEnableFallback());
        assertFalse(request.isIncludeGeometry());
        ResolveOptions options = request.toResolveOptions();
        assertFalse(options.isForceRouting());
        assertTrue(options.isEnableFallback());
        assertTrue(options.getThresholdKm().isEmpty());
    }

    @Test
    void explicitOptionsAreCarriedThrough() throws Exception {
        DistanceRequest request = mapper.readValue(
                "{\"from\":{\"latitude\":-37.8136,\"longitude\":144.9631},"
                        + "\"to\":{\"latitude\":-38.1499,\"longitude\":144.3617},"
                        + "\"profile\":\"walking\",\"forceRouting\":true,\"enableFallback\":false,"
                        + "\"includeGeometry\":true}",
                DistanceRequest.class);

        ResolveOptions options = request.toResolveOptions();
        assertEquals(TravelProfile.WALKING, request.toQuery().getProfile());
        assertTrue(options.isForceRouting());
        assertFalse(options.isEnableFallback());
        assertTrue(options.isIncludeGeometry());
    }

    @Test
    void missingDestinationIsRejected() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue(
                "{\"from\":{\"latitude\":-37.8136,\"longitude\":144.9631}}", DistanceRequest.class));
    }

    @Test
    void unknownProfileIsRejected() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue(
                "{\"from\":{\"latitude\":0,\"longitude\":0},\"to\":{\"latitude\":1,\"longitude\":1},"
                        + "\"profile\":\"sailing\"}", DistanceRequest.class));
    }

    @Test
    void batchRequestRejectsDuplicateIdsAndBadBatchSize() {
        assertThrows(JsonMappingException.class, () -> mapper.readValue(
                "{\"origin\":{\"latitude\":0,\"longitude\":0},\"destinations\":["
                        + "{\"id\":\"a\",\"coordinate\":{\"latitude\":1,\"longitude\":1}},"
                        + "{\"id\":\"a\",\"coordinate\":{\"latitude\":2,\"longitude\":2}}]}",
                BatchDistanceRequest.class));
        assertThrows(JsonMappingException.class, () -> mapper.readValue(
                "{\"origin\":{\"latitude\":0,\"longitude\":0},\"destinations\":[],\"batchSize\":0}",
                BatchDistanceRequest.class));
    }

    @Test
    void batchRequestOverridesConfiguredBatchSize() throws Exception {
        BatchDistanceRequest request = mapper.readValue(
                "{\"origin\":{\"latitude\":0,\"longitude\":0},"
                        + "\"destinations\":[{\"id\":\"a\",\"coordinate\":{\"latitude\":1,\"longitude\":1}}],"
                        + "\"profile\":\"cycling\",\"batchSize\":7}",
                BatchDistanceRequest.class);

        BatchOptions options = request.toBatchOptions(BatchOptions.from(RoutingConfig.defaults()));

        assertEquals(7, options.getBatchSize());
        assertEquals(TravelProfile.CYCLING, options.getProfile());
    }
}
