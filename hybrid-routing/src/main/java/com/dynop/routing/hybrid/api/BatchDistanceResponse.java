package com.dynop.routing.hybrid.api;

import com.dynop.routing.hybrid.model.RouteResult;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Batch results keyed by destination id, in request order.
 */
public final class BatchDistanceResponse {

    private final Map<String, RouteResult> results;

    @JsonCreator
    public BatchDistanceResponse(@JsonProperty("results") Map<String, RouteResult> results) {
        this.results = results == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    @JsonProperty("results")
    public Map<String, RouteResult> getResults() {
        return results;
    }
}
