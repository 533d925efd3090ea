package com.dynop.routing.hybrid.engine;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * Outcome of a connectivity probe. {@code method} is the wire name of the resolution method, or
 * {@code "error"} when the probe failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DiagnosticsReport {

    public static final String ERROR_METHOD = "error";

    private final boolean success;
    private final String method;
    private final long elapsedMs;
    @Nullable
    private final String error;

    @JsonCreator
    public DiagnosticsReport(
            @JsonProperty("success") boolean success,
            @JsonProperty("method") String method,
            @JsonProperty("elapsedMs") long elapsedMs,
            @JsonProperty("error") @Nullable String error) {
        this.success = success;
        this.method = method;
        this.elapsedMs = elapsedMs;
        this.error = error;
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return success;
    }

    @JsonProperty("method")
    public String getMethod() {
        return method;
    }

    @JsonProperty("elapsedMs")
    public long getElapsedMs() {
        return elapsedMs;
    }

    @Nullable
    @JsonProperty("error")
    public String getError() {
        return error;
    }
}
