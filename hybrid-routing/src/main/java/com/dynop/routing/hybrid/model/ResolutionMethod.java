package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a {@link RouteResult} was obtained.
 */
public enum ResolutionMethod {

    /**
     * Great-circle estimate computed locally; routing was not attempted.
     */
    @JsonProperty("geometry")
    GEOMETRY("geometry"),

    /**
     * Authoritative route returned by the routing provider.
     */
    @JsonProperty("routed")
    ROUTED("routed"),

    /**
     * Routing was attempted but failed; the value is a great-circle estimate.
     */
    @JsonProperty("routed-fallback")
    ROUTED_FALLBACK("routed-fallback");

    private final String wireName;

    ResolutionMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
