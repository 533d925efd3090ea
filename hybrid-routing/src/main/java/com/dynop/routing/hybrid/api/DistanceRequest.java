package com.dynop.routing.hybrid.api;

import com.dynop.routing.hybrid.engine.ResolveOptions;
import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.RouteQuery;
import com.dynop.routing.hybrid.model.TravelProfile;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Immutable request payload for a single distance resolution.
 *
 * <p>{@code profile} accepts {@code driving}, {@code walking} or {@code cycling} and defaults to driving.
 * {@code enableFallback} defaults to true, {@code forceRouting} and {@code includeGeometry} to false.
 */
public final class DistanceRequest {

    private final Coordinate from;
    private final Coordinate to;
    private final TravelProfile profile;
    private final boolean forceRouting;
    private final boolean enableFallback;
    private final boolean includeGeometry;

    @JsonCreator
    public DistanceRequest(
            @JsonProperty(value = "from", required = true) Coordinate from,
            @JsonProperty(value = "to", required = true) Coordinate to,
            @JsonProperty("profile") String profile,
            @JsonProperty(value = "forceRouting", defaultValue = "false") Boolean forceRouting,
            @JsonProperty(value = "enableFallback", defaultValue = "true") Boolean enableFallback,
            @JsonProperty(value = "includeGeometry", defaultValue = "false") Boolean includeGeometry) {
        this.from = Objects.requireNonNull(from, "from is required");
        this.to = Objects.requireNonNull(to, "to is required");
        this.profile = TravelProfile.parse(profile);
        this.forceRouting = Boolean.TRUE.equals(forceRouting);
        this.enableFallback = enableFallback == null || enableFallback;
        this.includeGeometry = Boolean.TRUE.equals(includeGeometry);
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

    public boolean isForceRouting() {
        return forceRouting;
    }

    public boolean isEnableFallback() {
        return enableFallback;
    }

    public boolean isIncludeGeometry() {
        return includeGeometry;
    }

    RouteQuery toQuery() {
        return RouteQuery.of(from, to, profile);
    }

    ResolveOptions toResolveOptions() {
        return ResolveOptions.defaults()
                .withForceRouting(forceRouting)
                .withEnableFallback(enableFallback)
                .withIncludeGeometry(includeGeometry);
    }
}
