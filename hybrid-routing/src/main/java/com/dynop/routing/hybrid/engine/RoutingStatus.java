package com.dynop.routing.hybrid.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the engine's routing availability.
 */
public final class RoutingStatus {

    private final boolean routingEnabled;
    private final boolean apiKeyConfigured;
    private final boolean cacheEnabled;
    private final double straightLineThresholdKm;
    private final int inFlightRequests;

    @JsonCreator
    public RoutingStatus(
            @JsonProperty("routingEnabled") boolean routingEnabled,
            @JsonProperty("apiKeyConfigured") boolean apiKeyConfigured,
            @JsonProperty("cacheEnabled") boolean cacheEnabled,
            @JsonProperty("straightLineThresholdKm") double straightLineThresholdKm,
            @JsonProperty("inFlightRequests") int inFlightRequests) {
        this.routingEnabled = routingEnabled;
        this.apiKeyConfigured = apiKeyConfigured;
        this.cacheEnabled = cacheEnabled;
        this.straightLineThresholdKm = straightLineThresholdKm;
        this.inFlightRequests = inFlightRequests;
    }

    /**
     * @return true when routing is switched on and a credential is configured
     */
    public boolean isRoutingEnabled() {
        return routingEnabled;
    }

    public boolean isApiKeyConfigured() {
        return apiKeyConfigured;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public double getStraightLineThresholdKm() {
        return straightLineThresholdKm;
    }

    public int getInFlightRequests() {
        return inFlightRequests;
    }
}
