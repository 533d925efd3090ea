package com.dynop.routing.hybrid.cache;

import com.dynop.routing.hybrid.model.RouteResult;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Cached route result with its validity window. Serialized as JSON when persisted.
 */
public final class CacheEntry {

    private final RouteResult result;
    private final Instant createdAt;
    private final Instant expiresAt;

    @JsonCreator
    public CacheEntry(
            @JsonProperty(value = "result", required = true) RouteResult result,
            @JsonProperty(value = "createdAt", required = true) Instant createdAt,
            @JsonProperty(value = "expiresAt", required = true) Instant expiresAt) {
        this.result = Objects.requireNonNull(result, "result");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt must not precede createdAt");
        }
    }

    public RouteResult getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * @return true once {@code now} has reached the expiry instant
     */
    @JsonIgnore
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
