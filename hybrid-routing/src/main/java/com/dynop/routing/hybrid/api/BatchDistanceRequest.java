package com.dynop.routing.hybrid.api;

import com.dynop.routing.hybrid.engine.BatchOptions;
import com.dynop.routing.hybrid.engine.ResolveOptions;
import com.dynop.routing.hybrid.model.Coordinate;
import com.dynop.routing.hybrid.model.Destination;
import com.dynop.routing.hybrid.model.TravelProfile;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable request payload for resolving one origin against many destinations.
 */
public final class BatchDistanceRequest {

    static final int MAX_DESTINATIONS = 500;

    private final Coordinate origin;
    private final List<Destination> destinations;
    private final TravelProfile profile;
    private final boolean forceRouting;
    @Nullable
    private final Integer batchSize;
    private final boolean includeGeometry;

    @JsonCreator
    public BatchDistanceRequest(
            @JsonProperty(value = "origin", required = true) Coordinate origin,
            @JsonProperty(value = "destinations", required = true) List<Destination> destinations,
            @JsonProperty("profile") String profile,
            @JsonProperty(value = "forceRouting", defaultValue = "false") Boolean forceRouting,
            @JsonProperty("batchSize") Integer batchSize,
            @JsonProperty(value = "includeGeometry", defaultValue = "false") Boolean includeGeometry) {
        this.origin = Objects.requireNonNull(origin, "origin is required");
        this.destinations = validateDestinations(destinations);
        this.profile = TravelProfile.parse(profile);
        this.forceRouting = Boolean.TRUE.equals(forceRouting);
        if (batchSize != null && batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        this.batchSize = batchSize;
        this.includeGeometry = Boolean.TRUE.equals(includeGeometry);
    }

    public Coordinate getOrigin() {
        return origin;
    }

    public List<Destination> getDestinations() {
        return destinations;
    }

    public TravelProfile getProfile() {
        return profile;
    }

    public boolean isForceRouting() {
        return forceRouting;
    }

    @Nullable
    public Integer getBatchSize() {
        return batchSize;
    }

    public boolean isIncludeGeometry() {
        return includeGeometry;
    }

    /**
     * Request options layered over the configured batching defaults.
     */
    BatchOptions toBatchOptions(BatchOptions defaults) {
        BatchOptions options = defaults
                .withProfile(profile)
                .withResolveOptions(ResolveOptions.defaults()
                        .withForceRouting(forceRouting)
                        .withIncludeGeometry(includeGeometry));
        return batchSize == null ? options : options.withBatchSize(batchSize);
    }

    private static List<Destination> validateDestinations(List<Destination> destinations) {
        if (destinations == null) {
            throw new IllegalArgumentException("destinations is required");
        }
        if (destinations.size() > MAX_DESTINATIONS) {
            throw new IllegalArgumentException("At most " + MAX_DESTINATIONS + " destinations are allowed");
        }
        Set<String> ids = new HashSet<>();
        List<Destination> copy = new ArrayList<>(destinations.size());
        for (Destination destination : destinations) {
            if (destination == null) {
                throw new IllegalArgumentException("destinations must not contain null entries");
            }
            if (!ids.add(destination.getId())) {
                throw new IllegalArgumentException("Duplicate destination id: " + destination.getId());
            }
            copy.add(destination);
        }
        return Collections.unmodifiableList(copy);
    }
}
