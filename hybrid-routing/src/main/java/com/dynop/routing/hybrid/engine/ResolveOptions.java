package com.dynop.routing.hybrid.engine;

import java.util.OptionalDouble;

/**
 * Per-call options for {@link DecisionPolicy#resolve(com.dynop.routing.hybrid.model.RouteQuery, ResolveOptions)}.
 *
 * <ul>
 *   <li>{@code forceRouting} - skip the straight-line threshold and the cache read</li>
 *   <li>{@code enableFallback} - only consulted with forced routing; when false an exhausted provider call
 *       fails the future instead of returning an estimate</li>
 *   <li>{@code thresholdKm} - overrides the configured straight-line threshold</li>
 *   <li>{@code includeGeometry} - keep the route polyline in the returned result</li>
 * </ul>
 */
public final class ResolveOptions {

    private static final ResolveOptions DEFAULTS = new ResolveOptions(false, true, null, false);

    private final boolean forceRouting;
    private final boolean enableFallback;
    private final Double thresholdKm;
    private final boolean includeGeometry;

    private ResolveOptions(boolean forceRouting, boolean enableFallback, Double thresholdKm, boolean includeGeometry) {
        if (thresholdKm != null && (thresholdKm.isNaN() || thresholdKm.isInfinite() || thresholdKm < 0)) {
            throw new IllegalArgumentException("thresholdKm must be a finite non-negative value");
        }
        this.forceRouting = forceRouting;
        this.enableFallback = enableFallback;
        this.thresholdKm = thresholdKm;
        this.includeGeometry = includeGeometry;
    }

    public static ResolveOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Options for navigation-style callers: forced fresh route, no fallback.
     */
    public static ResolveOptions navigation() {
        return new ResolveOptions(true, false, null, true);
    }

    public ResolveOptions withForceRouting(boolean value) {
        return new ResolveOptions(value, enableFallback, thresholdKm, includeGeometry);
    }

    public ResolveOptions withEnableFallback(boolean value) {
        return new ResolveOptions(forceRouting, value, thresholdKm, includeGeometry);
    }

    public ResolveOptions withThresholdKm(double value) {
        return new ResolveOptions(forceRouting, enableFallback, value, includeGeometry);
    }

    public ResolveOptions withIncludeGeometry(boolean value) {
        return new ResolveOptions(forceRouting, enableFallback, thresholdKm, value);
    }

    public boolean isForceRouting() {
        return forceRouting;
    }

    public boolean isEnableFallback() {
        return enableFallback;
    }

    public OptionalDouble getThresholdKm() {
        return thresholdKm == null ? OptionalDouble.empty() : OptionalDouble.of(thresholdKm);
    }

    public boolean isIncludeGeometry() {
        return includeGeometry;
    }
}
